package dev.shortlist.service;

import dev.shortlist.config.EvaluationConfig;
import dev.shortlist.exception.ValidationException;
import dev.shortlist.model.ContractType;
import dev.shortlist.model.JobRequirement;
import dev.shortlist.model.NormalizedSkill;
import dev.shortlist.model.RequirementHints;
import dev.shortlist.model.Seniority;
import dev.shortlist.pattern.JobPatterns;
import dev.shortlist.pattern.KeywordMatcher;
import dev.shortlist.pattern.PatternLibrary;
import dev.shortlist.pattern.SalaryPattern;
import dev.shortlist.pattern.SkillNormalizer;
import dev.shortlist.pattern.SkillOccurrence;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a free-text job description (and optional recruiter hints) into a
 * {@link JobRequirement}. Extraction never fails on the text itself: anything
 * that cannot be read falls back to its default.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequirementExtractor {

    private static final int MAX_PLAUSIBLE_YEARS = 40;
    private static final long MAX_PLAUSIBLE_SALARY = 10_000_000;
    private static final int MAX_TITLE_LINE = 100;
    private static final int CONTEXT_WINDOW = 60;
    private static final int MAX_HEADER_LENGTH = 60;
    private static final int MAX_HEADER_COLON = 50;
    private static final String CLAUSE_DELIMITERS = ",;.\n•";
    private static final Pattern BULLET_PREFIX = Pattern.compile("^[\\s\\-*•#>]+");
    private static final Pattern WORD = Pattern.compile("\\p{L}{4,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final PatternLibrary patternLibrary;
    private final SkillNormalizer skillNormalizer;
    private final EvaluationConfig evaluationConfig;

    enum SectionKind {
        REQUIRED, OPTIONAL, OTHER
    }

    record Section(SectionKind kind, int start, int end) {
        boolean contains(int offset) {
            return offset >= start && offset < end;
        }
    }

    private enum Need {
        REQUIRED, OPTIONAL
    }

    public JobRequirement extract(String jobText) {
        return extract(jobText, RequirementHints.none());
    }

    /**
     * Extract the requirement. Hints take precedence over the text.
     *
     * @throws ValidationException when the hints are inconsistent
     */
    public JobRequirement extract(String jobText, RequirementHints hints) {
        Objects.requireNonNull(jobText, "jobText");
        RequirementHints effective = hints == null ? RequirementHints.none() : hints;
        ContractType hintedContract = validateHints(effective);

        JobPatterns patterns = patternLibrary.job();
        String lower = KeywordMatcher.lowerCase(jobText);
        String normalized = KeywordMatcher.normalizeForMatching(jobText);

        int[] experience = extractExperience(lower, patterns, effective);
        int[] salary = extractSalary(lower, patterns, effective);
        Map<Need, Set<NormalizedSkill>> skills = extractSkills(jobText, lower, patterns, effective);

        JobRequirement requirement = JobRequirement.builder()
                .title(extractTitle(jobText, normalized, patterns, effective))
                .seniority(extractSeniority(normalized, patterns))
                .experienceMin(experience[0])
                .experienceMax(experience[1])
                .requiredSkills(skills.get(Need.REQUIRED))
                .optionalSkills(skills.get(Need.OPTIONAL))
                .languages(extractLanguages(normalized, effective))
                .location(extractLocation(jobText, normalized, patterns, effective))
                .salaryMin(salary[0])
                .salaryMax(salary[1])
                .contractType(hintedContract != null ? hintedContract : extractContract(normalized, patterns))
                .keywords(extractKeywords(lower, patterns))
                .notes(effective.notes())
                .build();

        log.debug("Extracted requirement '{}': {} required, {} optional skills, {}+ years",
                requirement.title(), requirement.requiredSkills().size(),
                requirement.optionalSkills().size(), requirement.experienceMin());
        return requirement;
    }

    private ContractType validateHints(RequirementHints hints) {
        if (hints.experienceMin() != null && hints.experienceMin() < 0) {
            throw new ValidationException("experienceMin must not be negative: " + hints.experienceMin());
        }
        if (hints.experienceMax() != null && hints.experienceMax() < 0) {
            throw new ValidationException("experienceMax must not be negative: " + hints.experienceMax());
        }
        if (hints.experienceMin() != null && hints.experienceMax() != null
                && hints.experienceMax() > 0 && hints.experienceMin() > hints.experienceMax()) {
            throw new ValidationException("experienceMin is greater than experienceMax");
        }
        if ((hints.salaryMin() != null && hints.salaryMin() < 0) || (hints.salaryMax() != null && hints.salaryMax() < 0)) {
            throw new ValidationException("Salary hints must not be negative");
        }
        if (hints.salaryMin() != null && hints.salaryMax() != null
                && hints.salaryMax() > 0 && hints.salaryMin() > hints.salaryMax()) {
            throw new ValidationException("salaryMin is greater than salaryMax");
        }
        return hints.contractType() == null ? null : ContractType.fromHint(hints.contractType());
    }

    private String extractTitle(String text, String normalized, JobPatterns patterns, RequirementHints hints) {
        if (hints.title() != null && !hints.title().isBlank()) {
            return hints.title().trim();
        }
        for (String title : patterns.titles()) {
            if (KeywordMatcher.containsWord(normalized, title)) {
                return titleCase(title);
            }
        }
        return text.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .findFirst()
                .filter(line -> line.length() < MAX_TITLE_LINE)
                .orElse(JobRequirement.UNSPECIFIED);
    }

    private Seniority extractSeniority(String normalized, JobPatterns patterns) {
        for (Map.Entry<Seniority, List<String>> group : patterns.seniority().entrySet()) {
            if (KeywordMatcher.containsAnyWord(normalized, group.getValue())) {
                return group.getKey();
            }
        }
        return Seniority.UNSPECIFIED;
    }

    /**
     * Returns {min, max}. A range ("3-5 years") sets both; single values only
     * raise the minimum. Values above forty years are ignored.
     */
    private int[] extractExperience(String lower, JobPatterns patterns, RequirementHints hints) {
        int min = 0;
        int max = 0;
        List<int[]> rangeSpans = new ArrayList<>();

        Matcher range = patterns.experienceRange().matcher(lower);
        while (range.find()) {
            int low = Integer.parseInt(range.group(1));
            int high = Integer.parseInt(range.group(2));
            rangeSpans.add(new int[]{range.start(), range.end()});
            if (high > MAX_PLAUSIBLE_YEARS || low > high) {
                continue;
            }
            min = Math.max(min, low);
            max = Math.max(max, high);
        }

        for (Pattern pattern : patterns.experiencePatterns()) {
            Matcher matcher = pattern.matcher(lower);
            while (matcher.find()) {
                if (overlaps(rangeSpans, matcher.start(), matcher.end())) {
                    continue;
                }
                int years = Integer.parseInt(matcher.group(1));
                if (years <= MAX_PLAUSIBLE_YEARS) {
                    min = Math.max(min, years);
                }
            }
        }

        if (hints.experienceMin() != null) {
            min = Math.max(min, hints.experienceMin());
        }
        if (hints.experienceMax() != null && hints.experienceMax() > 0) {
            max = hints.experienceMax();
        }
        if (max > 0 && max < min) {
            max = min;
        }
        return new int[]{min, max};
    }

    private static boolean overlaps(List<int[]> spans, int start, int end) {
        return spans.stream().anyMatch(span -> start < span[1] && end > span[0]);
    }

    private Map<Need, Set<NormalizedSkill>> extractSkills(String text, String lower, JobPatterns patterns,
                                                          RequirementHints hints) {
        List<Section> sections = findSections(text, patterns);
        boolean hasSkillSections = sections.stream().anyMatch(section -> section.kind() != SectionKind.OTHER);

        Map<NormalizedSkill, Need> needs = new LinkedHashMap<>();
        for (SkillOccurrence occurrence : skillNormalizer.findOccurrences(text)) {
            Need need = classify(occurrence, sections, hasSkillSections, lower, patterns);
            if (need == null) {
                log.debug("Ignoring '{}' at offset {}: outside any skill section", occurrence.skill(),
                        occurrence.start());
                continue;
            }
            needs.merge(occurrence.skill(), need, (previous, current) ->
                    previous == Need.REQUIRED || current == Need.REQUIRED ? Need.REQUIRED : Need.OPTIONAL);
        }

        Set<NormalizedSkill> required = new LinkedHashSet<>();
        Set<NormalizedSkill> optional = new LinkedHashSet<>();
        needs.forEach((skill, need) -> (need == Need.REQUIRED ? required : optional).add(skill));
        hints.requiredSkills().stream().filter(s -> !s.isBlank()).map(skillNormalizer::normalize).forEach(required::add);
        hints.optionalSkills().stream().filter(s -> !s.isBlank()).map(skillNormalizer::normalize).forEach(optional::add);
        optional.removeAll(required);

        Map<Need, Set<NormalizedSkill>> result = new LinkedHashMap<>();
        result.put(Need.REQUIRED, required);
        result.put(Need.OPTIONAL, optional);
        return result;
    }

    private Need classify(SkillOccurrence occurrence, List<Section> sections, boolean hasSkillSections,
                          String lower, JobPatterns patterns) {
        SectionKind kind = sections.stream()
                .filter(section -> section.contains(occurrence.start()))
                .map(Section::kind)
                .findFirst()
                .orElse(null);
        if (kind == SectionKind.REQUIRED) {
            return Need.REQUIRED;
        }
        if (kind == SectionKind.OPTIONAL) {
            return Need.OPTIONAL;
        }

        String clause = clauseAround(lower, occurrence.start(), occurrence.end());
        if (KeywordMatcher.containsAny(clause, patterns.optionalContext())) {
            return Need.OPTIONAL;
        }
        if (KeywordMatcher.containsAny(clause, patterns.requiredContext())) {
            return Need.REQUIRED;
        }
        if (hasSkillSections) {
            return null;
        }
        return patternLibrary.coreSkills().contains(occurrence.skill().key()) ? Need.REQUIRED : Need.OPTIONAL;
    }

    /**
     * The clause around a match: at most {@value #CONTEXT_WINDOW} characters on
     * each side, cut at the nearest clause delimiter.
     */
    static String clauseAround(String lower, int start, int end) {
        int left = start;
        int leftLimit = Math.max(0, start - CONTEXT_WINDOW);
        while (left > leftLimit && CLAUSE_DELIMITERS.indexOf(lower.charAt(left - 1)) < 0) {
            left--;
        }
        int right = end;
        int rightLimit = Math.min(lower.length(), end + CONTEXT_WINDOW);
        while (right < rightLimit && CLAUSE_DELIMITERS.indexOf(lower.charAt(right)) < 0) {
            right++;
        }
        return lower.substring(left, right);
    }

    /**
     * Sections opened by header lines. A header is a short line (or a line with
     * an early colon) starting with a known marker; its section runs to the next
     * header, or to the end of the text.
     */
    List<Section> findSections(String text, JobPatterns patterns) {
        List<Map.Entry<String, SectionKind>> markers = new ArrayList<>();
        patterns.requiredSections().forEach(m -> markers.add(Map.entry(m, SectionKind.REQUIRED)));
        patterns.optionalSections().forEach(m -> markers.add(Map.entry(m, SectionKind.OPTIONAL)));
        patterns.otherSections().forEach(m -> markers.add(Map.entry(m, SectionKind.OTHER)));
        markers.sort(Comparator.comparingInt((Map.Entry<String, SectionKind> e) -> e.getKey().length()).reversed());

        List<Integer> headerStarts = new ArrayList<>();
        List<SectionKind> headerKinds = new ArrayList<>();
        int offset = 0;
        for (String line : text.split("\n", -1)) {
            SectionKind kind = headerKind(line, markers);
            if (kind != null) {
                headerStarts.add(offset);
                headerKinds.add(kind);
            }
            offset += line.length() + 1;
        }

        List<Section> sections = new ArrayList<>();
        for (int i = 0; i < headerStarts.size(); i++) {
            int start = headerStarts.get(i);
            int end = i + 1 < headerStarts.size() ? headerStarts.get(i + 1) : text.length();
            sections.add(new Section(headerKinds.get(i), start, end));
        }
        return sections;
    }

    private static SectionKind headerKind(String line, List<Map.Entry<String, SectionKind>> markers) {
        String stripped = BULLET_PREFIX.matcher(KeywordMatcher.lowerCase(line)).replaceFirst("").trim();
        if (stripped.isEmpty()) {
            return null;
        }
        int colon = stripped.indexOf(':');
        boolean headerShaped = stripped.length() <= MAX_HEADER_LENGTH || (colon >= 0 && colon <= MAX_HEADER_COLON);
        if (!headerShaped) {
            return null;
        }
        for (Map.Entry<String, SectionKind> marker : markers) {
            String key = marker.getKey();
            if (stripped.startsWith(key)
                    && (stripped.length() == key.length() || !Character.isLetter(stripped.charAt(key.length())))) {
                return marker.getValue();
            }
        }
        return null;
    }

    private List<String> extractLanguages(String normalized, RequirementHints hints) {
        if (!hints.languages().isEmpty()) {
            return hints.languages();
        }
        List<String> languages = patternLibrary.languages().entrySet().stream()
                .filter(entry -> KeywordMatcher.containsAnyWord(normalized, entry.getValue()))
                .map(Map.Entry::getKey)
                .toList();
        return languages.isEmpty() ? List.of(evaluationConfig.getLocalLanguage()) : languages;
    }

    private String extractLocation(String text, String normalized, JobPatterns patterns, RequirementHints hints) {
        if (hints.location() != null && !hints.location().isBlank()) {
            return hints.location().trim();
        }
        Matcher line = patterns.locationLine().matcher(text);
        if (line.find()) {
            String value = line.group(1).replaceAll("[.;,]+$", "").trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return patterns.locations().entrySet().stream()
                .filter(entry -> KeywordMatcher.containsWord(normalized, entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(JobRequirement.UNSPECIFIED);
    }

    /**
     * Returns {min, max}. Patterns run on the lowercased text with all
     * whitespace removed, so "45 000 €" reads as "45000€".
     */
    private int[] extractSalary(String lower, JobPatterns patterns, RequirementHints hints) {
        if (hints.salaryMin() != null || hints.salaryMax() != null) {
            int min = hints.salaryMin() == null ? 0 : hints.salaryMin();
            int max = hints.salaryMax() == null ? min : hints.salaryMax();
            return new int[]{min, max};
        }
        String compact = WHITESPACE.matcher(lower).replaceAll("");
        for (SalaryPattern salaryPattern : patterns.salaryPatterns()) {
            Matcher matcher = salaryPattern.pattern().matcher(compact);
            if (!matcher.find()) {
                continue;
            }
            long first = amount(matcher.group(1), matcher.group(2));
            long second = salaryPattern.range() ? amount(matcher.group(3), matcher.group(4)) : first;
            if (salaryPattern.range() && matcher.group(2) == null && matcher.group(4) != null && first < 1000) {
                first *= 1000;
            }
            if (first > MAX_PLAUSIBLE_SALARY || second > MAX_PLAUSIBLE_SALARY) {
                log.debug("Ignoring implausible salary '{}'", matcher.group());
                continue;
            }
            return new int[]{(int) Math.min(first, second), (int) Math.max(first, second)};
        }
        return new int[]{0, 0};
    }

    private static long amount(String digits, String thousands) {
        long value = Long.parseLong(digits);
        return thousands != null ? value * 1000 : value;
    }

    private ContractType extractContract(String normalized, JobPatterns patterns) {
        for (Map.Entry<ContractType, List<String>> group : patterns.contracts().entrySet()) {
            if (KeywordMatcher.containsAnyWord(normalized, group.getValue())) {
                return group.getKey();
            }
        }
        return ContractType.PERMANENT;
    }

    private List<String> extractKeywords(String lower, JobPatterns patterns) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Matcher matcher = WORD.matcher(lower);
        while (matcher.find()) {
            String word = matcher.group();
            if (!patterns.stopwords().contains(word)) {
                counts.merge(word, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(evaluationConfig.getKeywordCount())
                .map(Map.Entry::getKey)
                .toList();
    }

    private static String titleCase(String phrase) {
        return Arrays.stream(phrase.split(" "))
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }
}
