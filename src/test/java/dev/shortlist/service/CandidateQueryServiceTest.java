package dev.shortlist.service;

import dev.shortlist.ai.AnswerProviderChain;
import dev.shortlist.exception.CollaboratorUnavailableException;
import dev.shortlist.exception.ValidationException;
import dev.shortlist.metrics.EvaluationMetrics;
import dev.shortlist.model.QueryAnswer;
import dev.shortlist.retrieval.RetrievalHit;
import dev.shortlist.retrieval.RetrievalService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CandidateQueryServiceTest {

    private static final String QUESTION = "Qui connaît Docker ?";

    @Mock
    private RetrievalService retrievalService;

    @Mock
    private AnswerProviderChain answerProviderChain;

    private SimpleMeterRegistry meterRegistry;
    private CandidateQueryService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new CandidateQueryService(retrievalService, answerProviderChain,
                new EvaluationMetrics(meterRegistry));
    }

    private static List<RetrievalHit> hits() {
        return List.of(
                new RetrievalHit("cvs/jean.txt", "Python, SQL, Docker", 0.83),
                new RetrievalHit("cvs/jean.txt", "Data Scientist chez Acme", 0.41),
                new RetrievalHit("cvs/paul.txt", "Docker en production", 0.30));
    }

    @Nested
    @DisplayName("With an answer provider")
    class ProviderTests {

        @BeforeEach
        void setUp() {
            when(retrievalService.search(QUESTION, 3)).thenReturn(hits());
            when(answerProviderChain.isAvailable()).thenReturn(true);
        }

        @Test
        @DisplayName("Should answer from the provider with deduplicated sources")
        void shouldAnswerFromProvider() {
            when(answerProviderChain.answer(contains("[jean.txt]"), eq(QUESTION)))
                    .thenReturn(Mono.just(new AnswerProviderChain.ProviderAnswer("groq", "Jean et Paul.")));

            StepVerifier.create(service.ask(QUESTION, 3))
                    .assertNext(answer -> {
                        assertThat(answer.answer()).isEqualTo("Jean et Paul.");
                        assertThat(answer.provider()).isEqualTo("groq");
                        assertThat(answer.retrievalOnly()).isFalse();
                        assertThat(answer.sources()).containsExactly("jean.txt", "paul.txt");
                    })
                    .verifyComplete();
            assertThat(meterRegistry.get("shortlist_answers_total").tag("provider", "groq")
                    .counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should fall back to excerpts when every provider fails")
        void shouldFallBackWhenProvidersFail() {
            when(answerProviderChain.answer(anyString(), eq(QUESTION)))
                    .thenReturn(Mono.error(new CollaboratorUnavailableException("Every answer provider failed")));

            StepVerifier.create(service.ask(QUESTION, 3))
                    .assertNext(answer -> {
                        assertThat(answer.retrievalOnly()).isTrue();
                        assertThat(answer.provider()).isEqualTo(QueryAnswer.RETRIEVAL_ONLY);
                        assertThat(answer.answer())
                                .startsWith("Most relevant excerpts:\n")
                                .contains("- jean.txt (0.83): Python, SQL, Docker");
                    })
                    .verifyComplete();
            assertThat(meterRegistry.get("shortlist_answer_fallbacks_total").counter().count()).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("Should return excerpts when no provider is enabled")
    void shouldReturnExcerptsWithoutProvider() {
        when(retrievalService.search(QUESTION, 3)).thenReturn(hits());
        when(answerProviderChain.isAvailable()).thenReturn(false);

        QueryAnswer answer = service.ask(QUESTION, 3).block();

        assertThat(answer).isNotNull();
        assertThat(answer.retrievalOnly()).isTrue();
        verify(answerProviderChain, never()).answer(anyString(), anyString());
    }

    @Test
    @DisplayName("Should say so when nothing relevant is found")
    void shouldHandleNoHits() {
        when(retrievalService.search(QUESTION, 3)).thenReturn(List.of());

        QueryAnswer answer = service.ask(QUESTION, 3).block();

        assertThat(answer).isNotNull();
        assertThat(answer.answer()).isEqualTo("No relevant résumé excerpt found.");
        assertThat(answer.sources()).isEmpty();
    }

    @Test
    @DisplayName("Should propagate an unbuilt index")
    void shouldPropagateUnbuiltIndex() {
        when(retrievalService.search(QUESTION, 3))
                .thenThrow(new CollaboratorUnavailableException("Retrieval index has not been built"));

        assertThatThrownBy(() -> service.ask(QUESTION, 3))
                .isInstanceOf(CollaboratorUnavailableException.class);
    }

    @Test
    @DisplayName("Should validate the question and k")
    void shouldValidateArguments() {
        assertThatThrownBy(() -> service.ask(" ", 3)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.ask(QUESTION, 0)).isInstanceOf(ValidationException.class);
    }
}
