package dev.shortlist.model;

import java.util.List;

public record SoftSkillAssessment(
        CriterionScore score,
        double motivation,
        double communication,
        double leadership,
        List<String> tags) {

    public SoftSkillAssessment {
        tags = List.copyOf(tags);
    }
}
