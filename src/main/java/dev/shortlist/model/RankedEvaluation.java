package dev.shortlist.model;

/**
 * A candidate's evaluation placed in the final ranking.
 */
public record RankedEvaluation(
        int rank,
        CandidateEvaluation evaluation,
        Recommendation recommendation,
        String justification) {

    public CandidateProfile profile() {
        return evaluation.profile();
    }

    public ScoreBreakdown breakdown() {
        return evaluation.breakdown();
    }

    public double globalScore() {
        return evaluation.globalScore();
    }

    public double similarity() {
        return evaluation.similarity();
    }

    public String sourceName() {
        return evaluation.sourceName();
    }
}
