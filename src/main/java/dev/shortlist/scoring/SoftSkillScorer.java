package dev.shortlist.scoring;

import dev.shortlist.model.CandidateProfile;
import dev.shortlist.model.CriterionScore;
import dev.shortlist.model.Experience;
import dev.shortlist.model.JobRequirement;
import dev.shortlist.model.SoftSkillAssessment;
import dev.shortlist.pattern.KeywordMatcher;
import dev.shortlist.pattern.PatternLibrary;
import dev.shortlist.pattern.SoftSkillPatterns;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Motivation, communication and leadership read from the cover letter and
 * the résumé, plus detected soft-skill tags.
 */
@Component
@RequiredArgsConstructor
public class SoftSkillScorer implements CriterionScorer {

    private static final int SHORT_LETTER = 50;
    private static final int VERY_SHORT_LETTER = 100;
    private static final int PERSONALISED_LETTER = 200;
    private static final int LONG_LETTER = 800;
    private static final int SALUTATION_WINDOW = 100;
    private static final int TAGS_IN_RATIONALE = 5;

    private final PatternLibrary patternLibrary;

    @Override
    public CriterionScore score(CandidateProfile profile, JobRequirement requirement) {
        return assess(profile).score();
    }

    public SoftSkillAssessment assess(CandidateProfile profile) {
        SoftSkillPatterns patterns = patternLibrary.softSkills();
        String letter = profile.coverLetter();
        String letterLower = KeywordMatcher.lowerCase(letter);
        String resumeLower = KeywordMatcher.lowerCase(profile.rawText());

        double motivation = motivation(letter, letterLower, patterns);
        double communication = communication(letter, letterLower, resumeLower, patterns);
        double leadership = leadership(resumeLower, profile.experiences(), patterns);
        List<String> tags = tags(letterLower + " " + resumeLower, patterns);

        double overall = clip(0.4 * motivation + 0.3 * communication + 0.2 * leadership
                + 0.1 * Math.min(100, 10 * tags.size()));
        return new SoftSkillAssessment(
                CriterionScore.of(overall, rationale(overall, motivation, communication, leadership, tags)),
                motivation, communication, leadership, tags);
    }

    private static double motivation(String letter, String letterLower, SoftSkillPatterns patterns) {
        if (letter.length() < SHORT_LETTER) {
            return 30;
        }
        double score = 50;
        score += Math.min(30, 5 * KeywordMatcher.countPresent(letterLower, patterns.motivationPositive()));
        score -= 10 * KeywordMatcher.countPresent(letterLower, patterns.motivationNegative());
        if (letter.length() > PERSONALISED_LETTER) {
            score += 10;
        }
        return clip(score);
    }

    private static double communication(String letter, String letterLower, String resumeLower,
                                        SoftSkillPatterns patterns) {
        double score = 50;
        if (!letter.isEmpty()) {
            String opening = letterLower.substring(0, Math.min(SALUTATION_WINDOW, letterLower.length()));
            if (KeywordMatcher.containsAny(opening, patterns.salutations())) {
                score += 10;
            }
            if (letter.length() >= PERSONALISED_LETTER && letter.length() <= LONG_LETTER) {
                score += 10;
            } else if (letter.length() < VERY_SHORT_LETTER) {
                score -= 20;
            }
            if (KeywordMatcher.containsAny(letterLower, patterns.closings())) {
                score += 10;
            }
        }
        if (!resumeLower.isBlank()) {
            long sections = patterns.resumeSections().values().stream()
                    .filter(keywords -> KeywordMatcher.containsAny(resumeLower, keywords))
                    .count();
            score += 5 * sections;
        }
        return clip(score);
    }

    private static double leadership(String resumeLower, List<Experience> experiences, SoftSkillPatterns patterns) {
        double score = 30;
        score += Math.min(40, 5 * KeywordMatcher.countPresent(resumeLower, patterns.leadership()));
        for (Experience experience : experiences) {
            String title = experience.title().toLowerCase(Locale.ROOT);
            if (KeywordMatcher.containsAny(title, patterns.leadershipTitles())) {
                score += 10;
            }
        }
        return clip(score);
    }

    private static List<String> tags(String text, SoftSkillPatterns patterns) {
        List<String> tags = new ArrayList<>();
        for (Map.Entry<String, List<String>> group : patterns.tags().entrySet()) {
            if (KeywordMatcher.containsAny(text, group.getValue())) {
                tags.add(group.getKey());
            }
        }
        return tags;
    }

    private static String rationale(double overall, double motivation, double communication, double leadership,
                                    List<String> tags) {
        List<String> parts = new ArrayList<>();
        if (overall >= 80) {
            parts.add("Excellent soft-skill profile");
        } else if (overall >= 60) {
            parts.add("Good soft-skill profile");
        } else if (overall >= 40) {
            parts.add("Acceptable soft-skill profile");
        } else {
            parts.add("Soft skills to develop");
        }
        parts.add(String.format(Locale.ROOT, "Score: %.1f/100", overall));
        parts.add(String.format(Locale.ROOT, "Motivation: %.1f/100", motivation));
        parts.add(String.format(Locale.ROOT, "Communication: %.1f/100", communication));
        parts.add(String.format(Locale.ROOT, "Leadership: %.1f/100", leadership));
        if (!tags.isEmpty()) {
            parts.add("Detected: " + String.join(", ", tags.subList(0, Math.min(TAGS_IN_RATIONALE, tags.size()))));
        }
        return String.join(" | ", parts);
    }

    private static double clip(double score) {
        return Math.max(0.0, Math.min(100.0, score));
    }
}
