package dev.shortlist.model;

import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Parameters of one evaluation run.
 */
@Builder
public record EvaluationRequest(
        String jobText,
        RequirementHints hints,
        List<String> candidateIds,
        RetrievalMode mode,
        int limit,
        Map<String, String> coverLetters) {

    public EvaluationRequest {
        hints = hints == null ? RequirementHints.none() : hints;
        candidateIds = candidateIds == null ? List.of() : List.copyOf(candidateIds);
        mode = mode == null ? RetrievalMode.SEMANTIC : mode;
        coverLetters = coverLetters == null ? Map.of() : Map.copyOf(coverLetters);
    }
}
