package dev.shortlist.retrieval;

import java.util.List;

public interface RetrievalService {

    /**
     * The most relevant chunks for a query, best first. May return fewer than
     * {@code k} hits.
     *
     * @throws dev.shortlist.exception.CollaboratorUnavailableException if the index is not ready
     */
    List<RetrievalHit> search(String query, int k);

    boolean isReady();
}
