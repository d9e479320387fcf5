package dev.shortlist.pattern;

import lombok.Builder;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Tables read by the profile extractor.
 */
@Builder
public record ResumePatterns(
        List<Pattern> nameDecorations,
        Pattern email,
        List<Pattern> phones,
        List<String> experienceSections,
        Pattern experienceWithParentheses,
        Pattern experienceWithDash,
        List<String> ongoingMarkers,
        List<String> educationSections,
        List<Pattern> educationPatterns) {
}
