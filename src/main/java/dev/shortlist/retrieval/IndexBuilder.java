package dev.shortlist.retrieval;

import dev.shortlist.model.RawDocument;

import java.util.List;

public interface IndexBuilder {

    /**
     * Replace the index content with the given documents.
     */
    IndexStats build(List<RawDocument> documents, IndexProgressListener listener);
}
