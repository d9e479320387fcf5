package dev.shortlist.metrics;

import dev.shortlist.job.JobKind;
import dev.shortlist.model.ResolutionTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus metrics for evaluation runs and tracked jobs.
 */
@Component
public class EvaluationMetrics {

    private static final String TAG_KIND = "kind";
    private static final String TAG_TIER = "tier";
    private static final String TAG_PROVIDER = "provider";

    private final MeterRegistry registry;

    // Counters
    private final Counter candidatesEvaluatedCounter;
    private final Counter unmatchedIdsCounter;
    private final Counter answerFallbacksCounter;

    private final Timer evaluationTimer;

    // Gauges
    private final AtomicInteger lastRunCandidates = new AtomicInteger(0);
    private final AtomicLong lastRunTopScoreCentis = new AtomicLong(0);

    public EvaluationMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.candidatesEvaluatedCounter = Counter.builder("shortlist_candidates_evaluated_total")
                .description("Total candidates scored")
                .register(registry);

        this.unmatchedIdsCounter = Counter.builder("shortlist_unmatched_ids_total")
                .description("Explicit candidate ids that matched no document")
                .register(registry);

        this.answerFallbacksCounter = Counter.builder("shortlist_answer_fallbacks_total")
                .description("Questions answered in retrieval-only mode")
                .register(registry);

        this.evaluationTimer = Timer.builder("shortlist_evaluation_duration")
                .description("Time to run one evaluation end to end")
                .register(registry);

        Gauge.builder("shortlist_last_run_candidates", lastRunCandidates, AtomicInteger::get)
                .description("Candidates ranked in last evaluation")
                .register(registry);

        Gauge.builder("shortlist_last_run_top_score", lastRunTopScoreCentis, value -> value.get() / 100.0)
                .description("Best global score in last evaluation")
                .register(registry);
    }

    public void recordJobSubmitted(JobKind kind) {
        jobCounter("shortlist_jobs_submitted_total", kind).increment();
    }

    public void recordJobCompleted(JobKind kind) {
        jobCounter("shortlist_jobs_completed_total", kind).increment();
    }

    public void recordJobFailed(JobKind kind) {
        jobCounter("shortlist_jobs_failed_total", kind).increment();
    }

    public void recordCandidatesEvaluated(int count) {
        candidatesEvaluatedCounter.increment(count);
    }

    /**
     * Record which resolution tier produced the candidates of a run.
     */
    public void recordResolution(ResolutionTier tier, int unmatchedIds) {
        Counter.builder("shortlist_resolution_tier_total")
                .tag(TAG_TIER, tier.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
        unmatchedIdsCounter.increment(unmatchedIds);
    }

    public void recordAnswer(String provider) {
        Counter.builder("shortlist_answers_total")
                .tag(TAG_PROVIDER, provider)
                .register(registry)
                .increment();
    }

    public void recordAnswerFallback() {
        answerFallbacksCounter.increment();
    }

    public void recordEvaluationDuration(Duration duration) {
        evaluationTimer.record(duration);
    }

    /**
     * Update last run statistics.
     */
    public void updateLastRunStats(int candidates, double topScore) {
        lastRunCandidates.set(candidates);
        lastRunTopScoreCentis.set(Math.round(topScore * 100));
    }

    private Counter jobCounter(String name, JobKind kind) {
        return Counter.builder(name)
                .tag(TAG_KIND, kind.name().toLowerCase(Locale.ROOT))
                .register(registry);
    }
}
