package dev.shortlist.model;

/**
 * Scores of one candidate before ranking.
 */
public record CandidateEvaluation(
        CandidateProfile profile,
        ScoreBreakdown breakdown,
        TechnicalAssessment technical,
        SoftSkillAssessment softSkills,
        String sourceName,
        double similarity) {

    public double globalScore() {
        return breakdown.globalScore();
    }
}
