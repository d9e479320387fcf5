package dev.shortlist.ai;

import reactor.core.publisher.Mono;

/**
 * A language model that answers questions about retrieved résumé excerpts.
 */
public interface AnswerProvider {

    /**
     * Answer a question from the given context.
     *
     * @param context  résumé excerpts the answer must be based on
     * @param question the recruiter's question
     * @return Mono with the answer; errors when the provider fails
     */
    Mono<String> answer(String context, String question);

    /**
     * Check if the provider is configured and can be called.
     */
    boolean isEnabled();

    /**
     * Short name used in configuration and metrics.
     */
    String name();
}
