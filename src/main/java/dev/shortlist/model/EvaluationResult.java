package dev.shortlist.model;

import java.util.List;

/**
 * Result stored on a completed evaluation job.
 */
public record EvaluationResult(
        JobRequirement requirement,
        List<RankedEvaluation> ranking,
        EvaluationReport report,
        ResolutionTier tier,
        List<String> unmatchedIds) {

    public EvaluationResult {
        ranking = List.copyOf(ranking);
        unmatchedIds = List.copyOf(unmatchedIds);
    }
}
