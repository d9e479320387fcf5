package dev.shortlist.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structured form of a job description.
 * <p>
 * A skill listed as both required and optional is kept only as required; the
 * canonical constructor enforces it, so every instance satisfies it.
 */
@Builder(toBuilder = true)
public record JobRequirement(
        String title,
        Seniority seniority,
        int experienceMin,
        int experienceMax,
        Set<NormalizedSkill> requiredSkills,
        Set<NormalizedSkill> optionalSkills,
        List<String> languages,
        String location,
        int salaryMin,
        int salaryMax,
        ContractType contractType,
        List<String> keywords,
        String notes) {

    public static final String UNSPECIFIED = "unspecified";

    public JobRequirement {
        title = (title == null || title.isBlank()) ? UNSPECIFIED : title;
        seniority = seniority == null ? Seniority.UNSPECIFIED : seniority;
        location = (location == null || location.isBlank()) ? UNSPECIFIED : location;
        contractType = contractType == null ? ContractType.PERMANENT : contractType;
        notes = notes == null ? "" : notes;

        Set<NormalizedSkill> required = requiredSkills == null
                ? new LinkedHashSet<>() : new LinkedHashSet<>(requiredSkills);
        Set<NormalizedSkill> optional = optionalSkills == null
                ? new LinkedHashSet<>() : new LinkedHashSet<>(optionalSkills);
        optional.removeAll(required);
        requiredSkills = Collections.unmodifiableSet(required);
        optionalSkills = Collections.unmodifiableSet(optional);

        languages = languages == null ? List.of() : List.copyOf(languages);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public boolean hasRequiredSkills() {
        return !requiredSkills.isEmpty();
    }

    public List<String> requiredSkillLabels() {
        return requiredSkills.stream().map(NormalizedSkill::label).toList();
    }

    public List<String> optionalSkillLabels() {
        return optionalSkills.stream().map(NormalizedSkill::label).toList();
    }
}
