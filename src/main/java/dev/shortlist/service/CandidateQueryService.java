package dev.shortlist.service;

import dev.shortlist.ai.AnswerProviderChain;
import dev.shortlist.exception.ValidationException;
import dev.shortlist.metrics.EvaluationMetrics;
import dev.shortlist.model.QueryAnswer;
import dev.shortlist.retrieval.RetrievalHit;
import dev.shortlist.retrieval.RetrievalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Free-text questions about the indexed résumés. The retrieved excerpts are
 * passed to the language model chain; when no model answers, the excerpts
 * themselves are returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateQueryService {

    private static final int EXCERPT_LENGTH = 200;

    private final RetrievalService retrievalService;
    private final AnswerProviderChain answerProviderChain;
    private final EvaluationMetrics metrics;

    /**
     * @throws ValidationException if the question is blank or {@code k} is not positive
     * @throws dev.shortlist.exception.CollaboratorUnavailableException if the index is not built
     */
    public Mono<QueryAnswer> ask(String question, int k) {
        if (question == null || question.isBlank()) {
            throw new ValidationException("Question must not be blank");
        }
        if (k <= 0) {
            throw new ValidationException("k must be positive, got " + k);
        }
        List<RetrievalHit> hits = retrievalService.search(question, k);
        List<String> sources = hits.stream()
                .map(hit -> CandidateResolver.basename(hit.source()))
                .distinct()
                .toList();

        if (hits.isEmpty() || !answerProviderChain.isAvailable()) {
            return Mono.just(retrievalOnly(question, hits, sources));
        }

        String context = hits.stream()
                .map(hit -> "[" + CandidateResolver.basename(hit.source()) + "]\n" + hit.content())
                .collect(Collectors.joining("\n\n"));
        return answerProviderChain.answer(context, question)
                .map(answer -> {
                    metrics.recordAnswer(answer.provider());
                    return new QueryAnswer(question, answer.text(), answer.provider(), sources, false);
                })
                .onErrorResume(e -> {
                    log.warn("No provider could answer, returning excerpts: {}", e.getMessage());
                    return Mono.just(retrievalOnly(question, hits, sources));
                });
    }

    private QueryAnswer retrievalOnly(String question, List<RetrievalHit> hits, List<String> sources) {
        metrics.recordAnswerFallback();
        String answer = hits.isEmpty()
                ? "No relevant résumé excerpt found."
                : hits.stream()
                        .map(hit -> String.format(Locale.ROOT, "- %s (%.2f): %s",
                                CandidateResolver.basename(hit.source()), hit.similarity(), excerpt(hit.content())))
                        .collect(Collectors.joining("\n", "Most relevant excerpts:\n", ""));
        return new QueryAnswer(question, answer, QueryAnswer.RETRIEVAL_ONLY, sources, true);
    }

    private static String excerpt(String content) {
        String flat = content.replace('\n', ' ').trim();
        return flat.length() > EXCERPT_LENGTH ? flat.substring(0, EXCERPT_LENGTH) + "..." : flat;
    }
}
