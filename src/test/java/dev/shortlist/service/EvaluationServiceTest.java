package dev.shortlist.service;

import dev.shortlist.TestFixtures;
import dev.shortlist.exception.ValidationException;
import dev.shortlist.job.ProgressReporter;
import dev.shortlist.metrics.EvaluationMetrics;
import dev.shortlist.model.CandidateEvaluation;
import dev.shortlist.model.CandidateResolution;
import dev.shortlist.model.EvaluationReport;
import dev.shortlist.model.EvaluationRequest;
import dev.shortlist.model.EvaluationResult;
import dev.shortlist.model.JobRequirement;
import dev.shortlist.model.RawDocument;
import dev.shortlist.model.ResolutionTier;
import dev.shortlist.model.RetrievalMode;
import dev.shortlist.model.Shortlist;
import dev.shortlist.pattern.PatternLibrary;
import dev.shortlist.scoring.ProfileScorer;
import dev.shortlist.scoring.SoftSkillScorer;
import dev.shortlist.scoring.TechnicalScorer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvaluationServiceTest {

    private static final String WEAK_RESUME = """
            PAUL MARTIN
            Commercial
            paul.martin@example.com

            EXPÉRIENCE
            Vendeur (2022 - 2024)

            COMPÉTENCES
            Négociation, prospection
            """;

    @Mock
    private CandidateResolver candidateResolver;

    private SimpleMeterRegistry meterRegistry;
    private EvaluationService service;

    @BeforeEach
    void setUp() {
        PatternLibrary library = TestFixtures.patternLibrary();
        meterRegistry = new SimpleMeterRegistry();
        service = new EvaluationService(
                TestFixtures.requirementExtractor(),
                candidateResolver,
                TestFixtures.profileExtractor(),
                new ProfileScorer(),
                new TechnicalScorer(),
                new SoftSkillScorer(library),
                new DecisionAggregator(TestFixtures.scoringConfig()),
                TestFixtures.evaluationConfig(),
                new EvaluationMetrics(meterRegistry));
    }

    private record ProgressEvent(int progress, String step, String message) {
    }

    @Nested
    @DisplayName("Full run")
    class RunEvaluationTests {

        private final List<ProgressEvent> events = Collections.synchronizedList(new ArrayList<>());
        private final ProgressReporter reporter =
                (progress, step, message) -> events.add(new ProgressEvent(progress, step, message));

        @BeforeEach
        void setUp() {
            when(candidateResolver.resolve(any(JobRequirement.class), eq(RetrievalMode.EXHAUSTIVE),
                    eq(List.of()), eq(10)))
                    .thenReturn(new CandidateResolution(List.of(
                            new RawDocument("paul.txt", WEAK_RESUME, 1.0),
                            new RawDocument("jean.txt", TestFixtures.RESUME, 1.0)),
                            ResolutionTier.ENUMERATION, List.of()));
        }

        private EvaluationResult run() {
            EvaluationRequest request = EvaluationRequest.builder()
                    .jobText(TestFixtures.JOB_DESCRIPTION)
                    .mode(RetrievalMode.EXHAUSTIVE)
                    .coverLetters(Map.of("jean", TestFixtures.COVER_LETTER))
                    .build();
            return service.runEvaluation(request, reporter);
        }

        @Test
        @DisplayName("Should rank the matching candidate first")
        void shouldRankMatchingCandidateFirst() {
            EvaluationResult result = run();

            assertThat(result.requirement().title()).isEqualTo("Data Scientist");
            assertThat(result.tier()).isEqualTo(ResolutionTier.ENUMERATION);
            assertThat(result.ranking()).hasSize(2);
            assertThat(result.ranking().get(0).profile().name()).isEqualTo("Jean Dupont");
            assertThat(result.ranking().get(0).rank()).isEqualTo(1);
            assertThat(result.ranking().get(0).globalScore())
                    .isGreaterThan(result.ranking().get(1).globalScore());
            assertThat(result.report().statistics().count()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should attach cover letters by file stem")
        void shouldAttachCoverLetters() {
            EvaluationResult result = run();

            assertThat(result.ranking().get(0).profile().hasCoverLetter()).isTrue();
            assertThat(result.ranking().get(1).profile().hasCoverLetter()).isFalse();
        }

        @Test
        @DisplayName("Should report increasing progress from each stage")
        void shouldReportProgress() {
            run();

            assertThat(events).extracting(ProgressEvent::step)
                    .containsExactly("requirement", "requirement", "resolving", "resolving",
                            "evaluating", "evaluating", "ranking");
            assertThat(events).extracting(ProgressEvent::progress)
                    .containsExactly(5, 10, 10, 20, 55, 90, 95)
                    .isSorted();
            assertThat(events.get(5).message()).endsWith("(2/2)");
        }

        @Test
        @DisplayName("Should record evaluation metrics")
        void shouldRecordMetrics() {
            run();

            assertThat(meterRegistry.get("shortlist_candidates_evaluated_total").counter().count()).isEqualTo(2.0);
            assertThat(meterRegistry.get("shortlist_resolution_tier_total").tag("tier", "enumeration")
                    .counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("shortlist_last_run_candidates").gauge().value()).isEqualTo(2.0);
            assertThat(meterRegistry.get("shortlist_evaluation_duration").timer().count()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Should produce an empty report when no candidate is found")
    void shouldHandleNoCandidates() {
        when(candidateResolver.resolve(any(JobRequirement.class), any(), any(), eq(10)))
                .thenReturn(new CandidateResolution(List.of(), ResolutionTier.ENUMERATION, List.of("zoe")));

        EvaluationResult result = service.runEvaluation(EvaluationRequest.builder()
                .jobText(TestFixtures.JOB_DESCRIPTION)
                .candidateIds(List.of("zoe"))
                .build(), ProgressReporter.none());

        assertThat(result.ranking()).isEmpty();
        assertThat(result.unmatchedIds()).containsExactly("zoe");
        assertThat(result.report().summary()).isEqualTo(EvaluationReport.NO_CANDIDATES);
    }

    @Test
    @DisplayName("Should rank and report an empty list without failing")
    void shouldRankAndReportEmptyList() {
        JobRequirement requirement = service.extractRequirement(TestFixtures.JOB_DESCRIPTION, null);

        Shortlist shortlist = service.rankAndReport(List.of(), requirement);

        assertThat(shortlist.ranking()).isEmpty();
        assertThat(shortlist.report().summary()).isEqualTo(EvaluationReport.NO_CANDIDATES);
        assertThat(shortlist.report().statistics().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should evaluate a single candidate without ranking")
    void shouldEvaluateOne() {
        JobRequirement requirement = service.extractRequirement(TestFixtures.JOB_DESCRIPTION, null);

        CandidateEvaluation evaluation = service.evaluateOne(
                new RawDocument("jean.txt", TestFixtures.RESUME, 0.8), requirement);

        assertThat(evaluation.sourceName()).isEqualTo("jean.txt");
        assertThat(evaluation.similarity()).isEqualTo(0.8);
        assertThat(evaluation.technical().matchedSkills()).contains("Python");
        assertThat(evaluation.globalScore()).isBetween(0.0, 100.0);
    }

    @Test
    @DisplayName("Should reject a blank job description")
    void shouldRejectBlankJobText() {
        EvaluationRequest request = EvaluationRequest.builder().jobText("  ").build();

        assertThatThrownBy(() -> service.runEvaluation(request, ProgressReporter.none()))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(candidateResolver);
    }
}
