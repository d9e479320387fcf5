package dev.shortlist.job;

import dev.shortlist.config.EvaluationConfig;
import dev.shortlist.exception.JobNotFoundException;
import dev.shortlist.metrics.EvaluationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Runs long work in the background and keeps a pollable record of it.
 * <p>
 * Submitting returns at once with the job id. The work runs on the
 * bounded-elastic scheduler and reports progress through the
 * {@link ProgressReporter} it is given; any failure, including a timeout,
 * ends the job in {@link JobStatus#ERROR} and is never rethrown to the
 * submitter.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobTracker {

    static final String CANCELLED = "cancelled";

    private final JobStore jobStore;
    private final EvaluationConfig evaluationConfig;
    private final EvaluationMetrics metrics;
    private final Clock clock;

    public UUID submit(JobKind kind, JobWork work) {
        TrackedJob job = new TrackedJob(UUID.randomUUID(), kind, clock.instant());
        jobStore.save(job);
        metrics.recordJobSubmitted(kind);
        log.info("Submitted {} job {}", kind, job.getId());

        Duration timeout = evaluationConfig.getJobTimeout();
        ProgressReporter reporter = (progress, step, message) -> job.update(progress, step, message, clock.instant());

        Disposable execution = Mono.fromCallable(() -> work.run(reporter))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .subscribe(
                        result -> completed(job, result),
                        error -> failed(job, error, timeout),
                        () -> completed(job, null));
        job.attach(execution);
        return job.getId();
    }

    /**
     * @throws JobNotFoundException if no job has this id
     */
    public JobSnapshot getJob(UUID id) {
        return tracked(id).snapshot();
    }

    public Optional<JobSnapshot> findJob(UUID id) {
        return jobStore.find(id).map(TrackedJob::snapshot);
    }

    /**
     * Emits the job's snapshot once it is completed or failed.
     */
    public Mono<JobSnapshot> awaitTerminal(UUID id) {
        return Mono.defer(() -> tracked(id).whenTerminal());
    }

    /**
     * Stop a running job. It ends in {@link JobStatus#ERROR} with the message
     * "cancelled"; a job that already finished is returned unchanged.
     */
    public JobSnapshot cancel(UUID id) {
        TrackedJob job = tracked(id);
        if (job.fail(CANCELLED, clock.instant())) {
            log.info("Cancelled {} job {}", job.getKind(), id);
            metrics.recordJobFailed(job.getKind());
        }
        return job.snapshot();
    }

    private TrackedJob tracked(UUID id) {
        return jobStore.find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    private void completed(TrackedJob job, Object result) {
        if (job.complete(result, clock.instant())) {
            log.info("{} job {} completed", job.getKind(), job.getId());
            metrics.recordJobCompleted(job.getKind());
        }
    }

    private void failed(TrackedJob job, Throwable error, Duration timeout) {
        String reason = error instanceof TimeoutException
                ? "Job timed out after " + timeout
                : describe(error);
        if (job.fail(reason, clock.instant())) {
            log.error("{} job {} failed: {}", job.getKind(), job.getId(), reason, error);
            metrics.recordJobFailed(job.getKind());
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
