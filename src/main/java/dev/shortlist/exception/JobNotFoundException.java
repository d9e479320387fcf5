package dev.shortlist.exception;

import java.util.UUID;

/**
 * Raised when a job id is not present in the tracker.
 */
public class JobNotFoundException extends NotFoundException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
