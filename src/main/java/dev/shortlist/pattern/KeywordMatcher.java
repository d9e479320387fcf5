package dev.shortlist.pattern;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token-boundary keyword matching shared by the extractors and scorers.
 * <p>
 * A boundary is any character that is not a letter, a digit, {@code +} or
 * {@code #}, so "java" is not found inside "javascript" and "c" is not found
 * inside "c++". An apostrophe before a token also counts as part of the
 * previous word, which keeps "ai" from matching inside "j'ai".
 */
public final class KeywordMatcher {

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    private static final String LEFT_BOUNDARY = "(?<![\\p{L}\\p{N}+#'’])";
    private static final String RIGHT_BOUNDARY = "(?![\\p{L}\\p{N}+#])";

    private KeywordMatcher() {
    }

    /**
     * Lowercase the text and turn {@code - _ .} into spaces. Every character maps
     * to exactly one character, so offsets in the result are offsets in the input.
     */
    public static String normalizeForMatching(String text) {
        if (text == null) {
            return "";
        }
        char[] chars = text.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            char c = Character.toLowerCase(chars[i]);
            chars[i] = (c == '-' || c == '_' || c == '.') ? ' ' : c;
        }
        return new String(chars);
    }

    /**
     * Lowercase character by character, keeping offsets aligned with the input.
     */
    public static String lowerCase(String text) {
        if (text == null) {
            return "";
        }
        char[] chars = text.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            chars[i] = Character.toLowerCase(chars[i]);
        }
        return new String(chars);
    }

    /**
     * Pattern for a keyword with token boundaries on both sides. Whitespace
     * inside the keyword matches any run of whitespace.
     */
    public static Pattern wordPattern(String keyword) {
        String key = keyword.toLowerCase(Locale.ROOT).trim();
        return PATTERN_CACHE.computeIfAbsent(key, k -> {
            StringBuilder regex = new StringBuilder(LEFT_BOUNDARY);
            String[] tokens = k.split("\\s+");
            for (int i = 0; i < tokens.length; i++) {
                if (i > 0) {
                    regex.append("\\s+");
                }
                regex.append(Pattern.quote(tokens[i]));
            }
            regex.append(RIGHT_BOUNDARY);
            return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        });
    }

    public static boolean containsWord(String text, String keyword) {
        if (text == null || keyword == null || keyword.isBlank()) {
            return false;
        }
        return wordPattern(keyword).matcher(text).find();
    }

    public static boolean containsAnyWord(String text, Collection<String> keywords) {
        return keywords.stream().anyMatch(keyword -> containsWord(text, keyword));
    }

    public static int countWord(String text, String keyword) {
        if (text == null || keyword == null || keyword.isBlank()) {
            return 0;
        }
        Matcher matcher = wordPattern(keyword).matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /**
     * Plain substring search on lowercased text, for keyword lists that are
     * word stems ("motiv", "collabor").
     */
    public static boolean containsAny(String lowerText, Collection<String> keywords) {
        return keywords.stream().anyMatch(lowerText::contains);
    }

    public static long countPresent(String lowerText, Collection<String> keywords) {
        return keywords.stream().filter(lowerText::contains).count();
    }
}
