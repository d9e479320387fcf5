package dev.shortlist.pattern;

import java.util.List;

/**
 * A vocabulary entry: the canonical key, its display label and the surface
 * forms searched for in text.
 */
public record SkillDefinition(String key, String label, List<String> aliases) {

    public SkillDefinition {
        aliases = List.copyOf(aliases);
    }

    public static SkillDefinition of(String key, String label, String... aliases) {
        return new SkillDefinition(key, label, List.of(aliases));
    }
}
