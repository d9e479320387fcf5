package dev.shortlist.scoring;

import dev.shortlist.model.CandidateProfile;
import dev.shortlist.model.CriterionScore;
import dev.shortlist.model.JobRequirement;

/**
 * One evaluation criterion. Implementations are pure: the same profile and
 * requirement always give the same score and rationale.
 */
public interface CriterionScorer {

    /**
     * Score a candidate on this criterion.
     *
     * @param profile     the candidate
     * @param requirement the job, or {@code null} to score the profile on its own
     * @return a score in [0, 100] with a short rationale
     */
    CriterionScore score(CandidateProfile profile, JobRequirement requirement);
}
