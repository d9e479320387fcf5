package dev.shortlist.pattern;

import dev.shortlist.model.NormalizedSkill;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The single place where skill identity is computed. The requirement
 * extractor, the profile extractor and the scorers all go through it, so a
 * skill read from a job description and the same skill read from a résumé
 * always end up with the same key.
 */
@Component
public class SkillNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[-_.]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<String, String> aliasToKey = new HashMap<>();
    private final Map<String, String> keyToLabel = new HashMap<>();
    private final List<AliasPattern> aliasPatterns = new ArrayList<>();

    public SkillNormalizer(PatternLibrary patternLibrary) {
        for (SkillDefinition definition : patternLibrary.skills()) {
            String key = clean(definition.key());
            keyToLabel.put(key, definition.label());
            aliasToKey.put(key, key);
            for (String alias : definition.aliases()) {
                String form = clean(alias);
                aliasToKey.putIfAbsent(form, key);
                aliasPatterns.add(new AliasPattern(key, KeywordMatcher.wordPattern(form)));
            }
        }
    }

    /**
     * Canonical key of a skill name: lowercase, {@code - _ .} read as spaces,
     * whitespace collapsed, then mapped through the alias table.
     */
    public String normalizeSkill(String raw) {
        String cleaned = clean(raw);
        return aliasToKey.getOrDefault(cleaned, cleaned);
    }

    public NormalizedSkill normalize(String raw) {
        String key = normalizeSkill(raw);
        return new NormalizedSkill(key, labelFor(key));
    }

    /**
     * Display label of a key: the vocabulary label when the key is known,
     * otherwise the key with each word capitalised.
     */
    public String labelFor(String key) {
        String label = keyToLabel.get(key);
        if (label != null) {
            return label;
        }
        return Arrays.stream(key.split(" "))
                .filter(word -> !word.isEmpty())
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    public boolean isKnown(String key) {
        return keyToLabel.containsKey(key);
    }

    /**
     * Every vocabulary occurrence in the text, ordered by position. Offsets
     * refer to the text as given.
     */
    public List<SkillOccurrence> findOccurrences(String text) {
        String normalized = KeywordMatcher.normalizeForMatching(text);
        List<SkillOccurrence> occurrences = new ArrayList<>();
        for (AliasPattern aliasPattern : aliasPatterns) {
            Matcher matcher = aliasPattern.pattern().matcher(normalized);
            NormalizedSkill skill = new NormalizedSkill(aliasPattern.key(), labelFor(aliasPattern.key()));
            while (matcher.find()) {
                occurrences.add(new SkillOccurrence(skill, matcher.start(), matcher.end()));
            }
        }
        occurrences.sort(Comparator.comparingInt(SkillOccurrence::start));
        return occurrences;
    }

    /**
     * Distinct skills found in the text, in order of first appearance.
     */
    public Set<NormalizedSkill> findSkills(String text) {
        Set<NormalizedSkill> skills = new LinkedHashSet<>();
        findOccurrences(text).forEach(occurrence -> skills.add(occurrence.skill()));
        return skills;
    }

    private static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        return WHITESPACE.matcher(SEPARATORS.matcher(lower).replaceAll(" ")).replaceAll(" ").trim();
    }

    private record AliasPattern(String key, Pattern pattern) {
    }
}
