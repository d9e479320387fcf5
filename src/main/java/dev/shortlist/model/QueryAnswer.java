package dev.shortlist.model;

import java.util.List;

/**
 * Answer to a free-text question about the indexed résumés. When no language
 * model could answer, {@code retrievalOnly} is set and the answer lists the
 * most relevant excerpts instead.
 */
public record QueryAnswer(String question, String answer, String provider, List<String> sources,
                          boolean retrievalOnly) {

    public static final String RETRIEVAL_ONLY = "retrieval-only";

    public QueryAnswer {
        sources = List.copyOf(sources);
    }
}
