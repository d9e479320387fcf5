package dev.shortlist.ai;

import org.springframework.web.reactive.function.client.WebClientResponseException;

final class AnswerPrompts {

    static final int MAX_CONTEXT_LENGTH = 6000;

    private AnswerPrompts() {
    }

    static String build(String context, String question) {
        String excerpt = context.length() > MAX_CONTEXT_LENGTH
                ? context.substring(0, MAX_CONTEXT_LENGTH) + "..."
                : context;
        return """
                You are a recruiting assistant. Answer the question using only the résumé excerpts below.
                Name the candidates you refer to. If the excerpts do not contain the answer, say so.

                Excerpts:
                %s

                Question: %s
                """.formatted(excerpt, question);
    }

    static boolean isRetryableError(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            return status == 429 || status == 500 || status == 503;
        }
        String msg = e.getMessage();
        return msg != null && (msg.contains("429") || msg.contains("500") || msg.contains("503"));
    }
}
