package dev.shortlist.job;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable view of a tracked job at one point in time.
 */
public record JobSnapshot(
        UUID id,
        JobKind kind,
        JobStatus status,
        int progress,
        String step,
        String message,
        Instant createdAt,
        Instant updatedAt,
        Instant finishedAt,
        Object result,
        String error) {

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * The job result cast to the expected type.
     *
     * @throws IllegalStateException if the job has no result of that type
     */
    public <T> T resultAs(Class<T> type) {
        if (!type.isInstance(result)) {
            throw new IllegalStateException("Job " + id + " has no result of type " + type.getSimpleName());
        }
        return type.cast(result);
    }
}
