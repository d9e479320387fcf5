package dev.shortlist.pattern;

import dev.shortlist.model.NormalizedSkill;

/**
 * One match of a skill alias, with offsets into the scanned text.
 */
public record SkillOccurrence(NormalizedSkill skill, int start, int end) {
}
