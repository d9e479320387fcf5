package dev.shortlist.model;

import lombok.Builder;

import java.util.List;

/**
 * Optional recruiter-supplied values that take precedence over what the
 * extractor reads from the job text.
 */
@Builder
public record RequirementHints(
        String title,
        Integer experienceMin,
        Integer experienceMax,
        List<String> requiredSkills,
        List<String> optionalSkills,
        List<String> languages,
        String location,
        Integer salaryMin,
        Integer salaryMax,
        String contractType,
        String notes) {

    public RequirementHints {
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
        optionalSkills = optionalSkills == null ? List.of() : List.copyOf(optionalSkills);
        languages = languages == null ? List.of() : List.copyOf(languages);
    }

    public static RequirementHints none() {
        return RequirementHints.builder().build();
    }
}
