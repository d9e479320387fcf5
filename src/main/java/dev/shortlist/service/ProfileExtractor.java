package dev.shortlist.service;

import dev.shortlist.config.EvaluationConfig;
import dev.shortlist.model.CandidateProfile;
import dev.shortlist.model.Education;
import dev.shortlist.model.Experience;
import dev.shortlist.model.JobRequirement;
import dev.shortlist.model.NormalizedSkill;
import dev.shortlist.pattern.KeywordMatcher;
import dev.shortlist.pattern.PatternLibrary;
import dev.shortlist.pattern.ResumePatterns;
import dev.shortlist.pattern.SkillNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads a {@link CandidateProfile} out of résumé text. Every field degrades to
 * a sentinel or an empty value instead of failing; degraded fields are logged
 * at debug level.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileExtractor {

    private static final int NAME_LINES = 10;
    private static final int MAX_EXPERIENCES = 10;
    private static final int MAX_EDUCATION = 5;
    private static final int MAX_DEGREE_LENGTH = 100;
    private static final int EXPERIENCE_SECTION_LENGTH = 2000;
    private static final int EDUCATION_SECTION_LENGTH = 1000;
    private static final int SECTION_MIN_LENGTH = 100;

    private static final Pattern ALL_CAPS_NAME = Pattern.compile("^[\\p{Lu}\\s]+$");
    private static final Pattern TITLE_CASE_NAME =
            Pattern.compile("^\\p{Lu}\\p{Ll}+(?:-\\p{Lu}\\p{Ll}+)?(?:\\s+\\p{Lu}\\p{Ll}+(?:-\\p{Lu}\\p{Ll}+)?)+$");
    private static final Pattern FOUR_DIGITS = Pattern.compile("\\d{4}");
    private static final Pattern YEAR = Pattern.compile("(\\d{4})");

    private final PatternLibrary patternLibrary;
    private final SkillNormalizer skillNormalizer;
    private final EvaluationConfig evaluationConfig;
    private final Clock clock;

    public CandidateProfile extract(String text) {
        return extract(text, "", null);
    }

    /**
     * Extract a profile from a résumé and an optional cover letter. When a
     * requirement is given, its skills outside the vocabulary are searched for
     * as well. Deterministic for a given clock year.
     */
    public CandidateProfile extract(String text, String coverLetter, JobRequirement requirement) {
        Objects.requireNonNull(text, "text");
        ResumePatterns patterns = patternLibrary.resume();

        String email = firstMatch(patterns.email(), text);
        String phone = patterns.phones().stream()
                .map(pattern -> firstMatch(pattern, text))
                .filter(match -> !match.isEmpty())
                .findFirst()
                .orElse("");
        String name = extractName(text, email, patterns);
        List<Experience> experiences = extractExperiences(text, patterns);
        List<Education> education = extractEducation(text, patterns);
        Set<NormalizedSkill> skills = extractSkills(text, requirement);
        Set<String> languages = extractLanguages(text);
        int currentYear = LocalDate.now(clock).getYear();
        double years = experiences.stream().mapToInt(experience -> experience.years(currentYear)).sum();

        if (email.isEmpty()) {
            log.debug("No email found in résumé starting with '{}'", preview(text));
        }
        if (experiences.isEmpty()) {
            log.debug("No dated experience found for '{}'", name);
        }

        return CandidateProfile.builder()
                .id(generateId(name, email))
                .name(name)
                .email(email)
                .phone(phone)
                .experiences(experiences)
                .education(education)
                .skills(skills)
                .languages(languages)
                .yearsExperience(Math.max(0, years))
                .rawText(text)
                .coverLetter(coverLetter)
                .build();
    }

    private String extractName(String text, String email, ResumePatterns patterns) {
        List<String> lines = text.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .limit(NAME_LINES)
                .toList();
        for (String line : lines) {
            String cleaned = line;
            for (Pattern decoration : patterns.nameDecorations()) {
                cleaned = decoration.matcher(cleaned).replaceFirst("");
            }
            cleaned = cleaned.trim();
            if (cleaned.contains("@") || cleaned.toLowerCase(Locale.ROOT).contains("http")
                    || FOUR_DIGITS.matcher(cleaned).find()) {
                continue;
            }
            if (cleaned.length() <= 3 || cleaned.length() >= 50) {
                continue;
            }
            int words = cleaned.split("\\s+").length;
            if (words < 2 || words > 4) {
                continue;
            }
            if (ALL_CAPS_NAME.matcher(cleaned).matches()) {
                return capitalizeWords(cleaned);
            }
            if (TITLE_CASE_NAME.matcher(cleaned).matches()) {
                return cleaned;
            }
        }

        if (!email.isEmpty()) {
            String[] parts = email.substring(0, email.indexOf('@')).split("\\.");
            if (parts.length == 2 && !parts[0].isEmpty() && !parts[1].isEmpty()) {
                return capitalizeWords(parts[0] + " " + parts[1]);
            }
        }
        log.debug("Name not found in résumé starting with '{}'", preview(text));
        return CandidateProfile.NAME_NOT_FOUND;
    }

    /**
     * Entries written as "Title (2019 - 2021)" are read first, then
     * "Title - 2019 - present"; a span already claimed by the first form is not
     * read again.
     */
    private List<Experience> extractExperiences(String text, ResumePatterns patterns) {
        String section = section(text, patterns.experienceSections(), EXPERIENCE_SECTION_LENGTH);
        List<Experience> experiences = new ArrayList<>();
        List<int[]> claimed = new ArrayList<>();

        for (Pattern pattern : List.of(patterns.experienceWithParentheses(), patterns.experienceWithDash())) {
            Matcher matcher = pattern.matcher(section);
            while (matcher.find() && experiences.size() < MAX_EXPERIENCES) {
                int start = matcher.start();
                int end = matcher.end();
                if (claimed.stream().anyMatch(span -> start < span[1] && end > span[0])) {
                    continue;
                }
                Experience experience = toExperience(matcher, patterns);
                if (experience != null) {
                    claimed.add(new int[]{start, end});
                    experiences.add(experience);
                }
            }
        }
        return experiences;
    }

    private Experience toExperience(Matcher matcher, ResumePatterns patterns) {
        Matcher startYear = YEAR.matcher(matcher.group(2));
        if (!startYear.find()) {
            return null;
        }
        String title = matcher.group(1).trim();
        int start = Integer.parseInt(startYear.group(1));
        String endToken = matcher.group(3);
        if (endToken == null) {
            return new Experience(title, start, null, false);
        }
        if (patterns.ongoingMarkers().contains(endToken.toLowerCase(Locale.ROOT))) {
            return new Experience(title, start, null, true);
        }
        Matcher endYear = YEAR.matcher(endToken);
        return endYear.find()
                ? new Experience(title, start, Integer.parseInt(endYear.group(1)), false)
                : new Experience(title, start, null, false);
    }

    private Set<NormalizedSkill> extractSkills(String text, JobRequirement requirement) {
        Set<NormalizedSkill> skills = skillNormalizer.findSkills(text);
        if (requirement == null) {
            return skills;
        }
        String normalized = KeywordMatcher.normalizeForMatching(text);
        Stream.concat(requirement.requiredSkills().stream(), requirement.optionalSkills().stream())
                .filter(skill -> !skillNormalizer.isKnown(skill.key()))
                .filter(skill -> KeywordMatcher.containsWord(normalized, skill.key()))
                .forEach(skills::add);
        return skills;
    }

    private List<Education> extractEducation(String text, ResumePatterns patterns) {
        String section = section(text, patterns.educationSections(), EDUCATION_SECTION_LENGTH);
        Set<String> degrees = new LinkedHashSet<>();
        for (Pattern pattern : patterns.educationPatterns()) {
            Matcher matcher = pattern.matcher(section);
            while (matcher.find() && degrees.size() < MAX_EDUCATION) {
                String degree = matcher.group().trim();
                degrees.add(degree.length() > MAX_DEGREE_LENGTH ? degree.substring(0, MAX_DEGREE_LENGTH) : degree);
            }
        }
        return degrees.stream().map(Education::new).toList();
    }

    private Set<String> extractLanguages(String text) {
        String normalized = KeywordMatcher.normalizeForMatching(text);
        Set<String> languages = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> language : patternLibrary.languages().entrySet()) {
            if (KeywordMatcher.containsAnyWord(normalized, language.getValue())) {
                languages.add(language.getKey());
            }
        }
        if (languages.isEmpty()) {
            languages.add(evaluationConfig.getLocalLanguage());
        }
        return languages;
    }

    /**
     * Text from the first section keyword found (in keyword order) to the next
     * blank line at least {@value #SECTION_MIN_LENGTH} characters later, or to a
     * fixed length. Falls back to the whole text.
     */
    private static String section(String text, List<String> keywords, int maxLength) {
        String lower = KeywordMatcher.lowerCase(text);
        for (String keyword : keywords) {
            int index = lower.indexOf(keyword);
            if (index < 0) {
                continue;
            }
            int end = text.indexOf("\n\n", index + SECTION_MIN_LENGTH);
            if (end < 0) {
                end = Math.min(index + maxLength, text.length());
            }
            return text.substring(index, end);
        }
        return text;
    }

    private static String generateId(String name, String email) {
        if (!email.isEmpty()) {
            return email.substring(0, email.indexOf('@'));
        }
        return name.toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    private static String firstMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group() : "";
    }

    private static String capitalizeWords(String value) {
        return Arrays.stream(value.trim().split("\\s+"))
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT)
                        + word.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }

    private static String preview(String text) {
        String flat = text.replace('\n', ' ').trim();
        return flat.length() > 40 ? flat.substring(0, 40) + "..." : flat;
    }
}
