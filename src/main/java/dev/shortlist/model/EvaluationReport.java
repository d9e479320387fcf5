package dev.shortlist.model;

import java.util.List;

public record EvaluationReport(
        String summary,
        ReportStatistics statistics,
        List<RankedEvaluation> topCandidates,
        JobRequirement requirement) {

    public static final String NO_CANDIDATES = "no candidates evaluated";

    public EvaluationReport {
        topCandidates = List.copyOf(topCandidates);
    }

    public static EvaluationReport empty(JobRequirement requirement) {
        return new EvaluationReport(NO_CANDIDATES, ReportStatistics.EMPTY, List.of(), requirement);
    }
}
