package dev.shortlist.model;

/**
 * Score of one criterion, always within [0, 100].
 */
public record CriterionScore(double score, String rationale) {

    public CriterionScore {
        score = Math.max(0.0, Math.min(100.0, score));
        rationale = rationale == null ? "" : rationale;
    }

    public static CriterionScore of(double score, String rationale) {
        return new CriterionScore(score, rationale);
    }
}
