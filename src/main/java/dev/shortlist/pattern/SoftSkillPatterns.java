package dev.shortlist.pattern;

import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Tables read by the soft-skill scorer. All keywords are lowercase and matched
 * as substrings, so stems such as "motiv" are allowed.
 */
@Builder
public record SoftSkillPatterns(
        List<String> motivationPositive,
        List<String> motivationNegative,
        List<String> salutations,
        List<String> closings,
        Map<String, List<String>> resumeSections,
        List<String> leadership,
        List<String> leadershipTitles,
        Map<String, List<String>> tags) {
}
