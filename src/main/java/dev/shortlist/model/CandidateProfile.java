package dev.shortlist.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structured form of one résumé (plus an optional cover letter).
 */
@Builder(toBuilder = true)
public record CandidateProfile(
        String id,
        String name,
        String email,
        String phone,
        List<Experience> experiences,
        List<Education> education,
        Set<NormalizedSkill> skills,
        Set<String> languages,
        double yearsExperience,
        String rawText,
        String coverLetter) {

    public static final String NAME_NOT_FOUND = "name not found";

    public CandidateProfile {
        name = (name == null || name.isBlank()) ? NAME_NOT_FOUND : name;
        email = email == null ? "" : email;
        phone = phone == null ? "" : phone;
        experiences = experiences == null ? List.of() : List.copyOf(experiences);
        education = education == null ? List.of() : List.copyOf(education);
        skills = skills == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(skills));
        languages = languages == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(languages));
        yearsExperience = Math.max(0, yearsExperience);
        rawText = rawText == null ? "" : rawText;
        coverLetter = coverLetter == null ? "" : coverLetter;
    }

    public boolean hasCoverLetter() {
        return !coverLetter.isBlank();
    }
}
