package dev.shortlist.scoring;

import dev.shortlist.model.NormalizedSkill;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Decides whether a candidate holds a wanted skill. Tries, in order: equal
 * keys, one key contained in the other (the shorter one must have at least
 * {@value #MIN_SUBSTRING_LENGTH} characters), then shared words between
 * multi-word keys.
 */
public final class SkillMatcher {

    static final int MIN_SUBSTRING_LENGTH = 3;

    private SkillMatcher() {
    }

    public static boolean matchesAny(NormalizedSkill wanted, Collection<NormalizedSkill> held) {
        return held.stream().anyMatch(candidate -> matches(wanted.key(), candidate.key()));
    }

    public static boolean matches(String wanted, String held) {
        if (wanted.equals(held)) {
            return true;
        }
        boolean wantedShorter = wanted.length() <= held.length();
        String shorter = wantedShorter ? wanted : held;
        String longer = wantedShorter ? held : wanted;
        if (shorter.length() >= MIN_SUBSTRING_LENGTH && longer.contains(shorter)) {
            return true;
        }
        return wordOverlap(wanted, held);
    }

    /**
     * Multi-word keys match when they share at least {@code min(2, words - 1)}
     * words, counted on the wanted skill and never fewer than one.
     */
    private static boolean wordOverlap(String wanted, String held) {
        Set<String> wantedWords = words(wanted);
        if (wantedWords.size() < 2) {
            return false;
        }
        Set<String> shared = new HashSet<>(wantedWords);
        shared.retainAll(words(held));
        int needed = Math.max(1, Math.min(2, wantedWords.size() - 1));
        return shared.size() >= needed;
    }

    private static Set<String> words(String key) {
        return new HashSet<>(Arrays.asList(key.split(" ")));
    }
}
