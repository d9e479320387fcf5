package dev.shortlist.model;

import java.util.List;

/**
 * Ranked candidates with the report computed over them.
 */
public record Shortlist(List<RankedEvaluation> ranking, EvaluationReport report) {

    public Shortlist {
        ranking = List.copyOf(ranking);
    }
}
