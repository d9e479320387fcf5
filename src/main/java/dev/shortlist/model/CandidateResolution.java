package dev.shortlist.model;

import java.util.List;

public record CandidateResolution(List<RawDocument> documents, ResolutionTier tier, List<String> unmatchedIds) {

    public CandidateResolution {
        documents = List.copyOf(documents);
        unmatchedIds = List.copyOf(unmatchedIds);
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }
}
