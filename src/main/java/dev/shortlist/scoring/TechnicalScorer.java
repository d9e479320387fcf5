package dev.shortlist.scoring;

import dev.shortlist.model.CandidateProfile;
import dev.shortlist.model.CriterionScore;
import dev.shortlist.model.JobRequirement;
import dev.shortlist.model.NormalizedSkill;
import dev.shortlist.model.TechnicalAssessment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Match between the candidate's skills and the job's required and optional
 * skills. Required skills are worth up to 70 points plus a 5 point bonus when
 * all of them are held; optional skills up to 30.
 */
@Component
public class TechnicalScorer implements CriterionScorer {

    private static final PiecewiseCurve REQUIRED_CURVE = PiecewiseCurve.topAt(1.0, 70)
            .band(0.9, 65)
            .band(0.75, 55)
            .band(0.6, 40)
            .band(0.5, 25)
            .build(70);

    private static final PiecewiseCurve OPTIONAL_CURVE = PiecewiseCurve.topAt(0.8, 30)
            .band(0.6, 20)
            .band(0.4, 10)
            .build(30);

    private static final double ALL_REQUIRED_BONUS = 5;
    private static final double NO_SKILLS_LISTED = 50;
    private static final int SKILLS_IN_RATIONALE = 5;

    @Override
    public CriterionScore score(CandidateProfile profile, JobRequirement requirement) {
        return assess(profile, requirement).score();
    }

    public TechnicalAssessment assess(CandidateProfile profile, JobRequirement requirement) {
        List<String> matched = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        List<String> optionalMatched = new ArrayList<>();

        if (requirement == null) {
            return new TechnicalAssessment(
                    CriterionScore.of(NO_SKILLS_LISTED, "No job requirement to compare against"),
                    matched, missing, optionalMatched);
        }

        for (NormalizedSkill skill : requirement.requiredSkills()) {
            (SkillMatcher.matchesAny(skill, profile.skills()) ? matched : missing).add(skill.label());
        }
        for (NormalizedSkill skill : requirement.optionalSkills()) {
            if (SkillMatcher.matchesAny(skill, profile.skills())) {
                optionalMatched.add(skill.label());
            }
        }

        int requiredCount = requirement.requiredSkills().size();
        int optionalCount = requirement.optionalSkills().size();
        double score;
        if (requiredCount == 0) {
            score = optionalCount > 0 ? 100.0 * optionalMatched.size() / optionalCount : NO_SKILLS_LISTED;
        } else {
            score = REQUIRED_CURVE.apply((double) matched.size() / requiredCount);
            if (missing.isEmpty()) {
                score += ALL_REQUIRED_BONUS;
            }
            if (optionalCount > 0) {
                score += OPTIONAL_CURVE.apply((double) optionalMatched.size() / optionalCount);
            }
            score = Math.min(100.0, score);
        }

        return new TechnicalAssessment(
                CriterionScore.of(score, rationale(score, matched, missing, optionalMatched)),
                matched, missing, optionalMatched);
    }

    private static String rationale(double score, List<String> matched, List<String> missing,
                                    List<String> optionalMatched) {
        List<String> parts = new ArrayList<>();
        if (score >= 80) {
            parts.add("Excellent technical fit");
        } else if (score >= 60) {
            parts.add("Good technical fit");
        } else if (score >= 40) {
            parts.add("Acceptable technical fit");
        } else {
            parts.add("Insufficient technical fit");
        }
        parts.add(String.format(Locale.ROOT, "Score: %.1f/100", score));
        if (!matched.isEmpty()) {
            parts.add(String.format(Locale.ROOT, "Matched skills (%d/%d): %s", matched.size(),
                    matched.size() + missing.size(), head(matched)));
        }
        if (!missing.isEmpty()) {
            parts.add("Missing skills: " + head(missing));
        }
        if (!optionalMatched.isEmpty()) {
            parts.add("Optional skills found: " + head(optionalMatched));
        }
        return String.join(" | ", parts);
    }

    private static String head(List<String> skills) {
        return String.join(", ", skills.subList(0, Math.min(SKILLS_IN_RATIONALE, skills.size())));
    }
}
