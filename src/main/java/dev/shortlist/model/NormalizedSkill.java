package dev.shortlist.model;

import java.util.Objects;

/**
 * A skill identified by its canonical key. The label is only for display and
 * is derived from the key, so two skills with the same key are the same skill.
 */
public record NormalizedSkill(String key, String label) {

    public NormalizedSkill {
        Objects.requireNonNull(key, "key");
        label = (label == null || label.isBlank()) ? key : label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof NormalizedSkill other && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return label;
    }
}
