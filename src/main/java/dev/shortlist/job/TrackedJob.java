package dev.shortlist.job;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.UUID;

/**
 * Mutable state of one job. Every mutation holds this entry's monitor, and
 * nothing changes once the job is terminal.
 */
@Slf4j
public final class TrackedJob {

    @Getter
    private final UUID id;
    @Getter
    private final JobKind kind;
    private final Instant createdAt;
    private final Sinks.One<JobSnapshot> terminal = Sinks.one();

    private JobStatus status = JobStatus.RUNNING;
    private int progress;
    private String step = "queued";
    private String message = "Job submitted";
    private Instant updatedAt;
    private Instant finishedAt;
    private Object result;
    private String error;
    private Disposable execution;

    TrackedJob(UUID id, JobKind kind, Instant createdAt) {
        this.id = id;
        this.kind = kind;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public synchronized JobSnapshot snapshot() {
        return new JobSnapshot(id, kind, status, progress, step, message,
                createdAt, updatedAt, finishedAt, result, error);
    }

    /**
     * Emits the snapshot once the job is terminal, immediately if it already is.
     */
    public Mono<JobSnapshot> whenTerminal() {
        return terminal.asMono();
    }

    synchronized void attach(Disposable execution) {
        if (status.isTerminal()) {
            execution.dispose();
            return;
        }
        this.execution = execution;
    }

    synchronized void update(int newProgress, String newStep, String newMessage, Instant now) {
        if (status.isTerminal()) {
            log.debug("Ignoring update on finished job {}: {}", id, newMessage);
            return;
        }
        int clamped = Math.max(0, Math.min(100, newProgress));
        if (clamped < progress) {
            log.warn("Job {} progress went back from {} to {} at step '{}'", id, progress, clamped, newStep);
        } else {
            progress = clamped;
        }
        if (newStep != null) {
            step = newStep;
        }
        if (newMessage != null) {
            message = newMessage;
        }
        updatedAt = now;
    }

    boolean complete(Object value, Instant now) {
        JobSnapshot done;
        synchronized (this) {
            if (status.isTerminal()) {
                return false;
            }
            status = JobStatus.COMPLETED;
            progress = 100;
            step = "done";
            message = "Completed";
            result = value;
            updatedAt = now;
            finishedAt = now;
            done = snapshot();
        }
        terminal.tryEmitValue(done);
        return true;
    }

    boolean fail(String reason, Instant now) {
        JobSnapshot failed;
        Disposable running;
        synchronized (this) {
            if (status.isTerminal()) {
                return false;
            }
            status = JobStatus.ERROR;
            error = reason;
            message = reason;
            updatedAt = now;
            finishedAt = now;
            running = execution;
            failed = snapshot();
        }
        if (running != null) {
            running.dispose();
        }
        terminal.tryEmitValue(failed);
        return true;
    }
}
