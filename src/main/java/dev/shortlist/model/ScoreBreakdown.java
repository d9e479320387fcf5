package dev.shortlist.model;

public record ScoreBreakdown(
        CriterionScore profile,
        CriterionScore technical,
        CriterionScore softSkill,
        double globalScore) {
}
