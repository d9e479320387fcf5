package dev.shortlist.service;

import dev.shortlist.exception.ValidationException;
import dev.shortlist.job.JobKind;
import dev.shortlist.job.JobSnapshot;
import dev.shortlist.job.JobTracker;
import dev.shortlist.model.EvaluationRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Entry point for long-running work: submits evaluation and index build jobs
 * and exposes their snapshots for polling.
 */
@Service
@RequiredArgsConstructor
public class ShortlistJobService {

    private final JobTracker jobTracker;
    private final EvaluationService evaluationService;
    private final IndexBuildService indexBuildService;

    /**
     * Submit a job of the given kind. An evaluation takes an
     * {@link EvaluationRequest}; an index build takes no parameters.
     *
     * @return the job id, returned before any work is done
     * @throws ValidationException if the parameters do not fit the kind
     */
    public UUID submitJob(JobKind kind, Object params) {
        return switch (kind) {
            case EVALUATION -> {
                if (!(params instanceof EvaluationRequest request)) {
                    throw new ValidationException("An evaluation job needs an EvaluationRequest");
                }
                yield submitEvaluation(request);
            }
            case INDEX_BUILD -> {
                if (params != null) {
                    throw new ValidationException("An index build job takes no parameters");
                }
                yield submitIndexBuild();
            }
        };
    }

    public UUID submitEvaluation(EvaluationRequest request) {
        if (request.jobText() == null || request.jobText().isBlank()) {
            throw new ValidationException("Job description text is required");
        }
        if (request.limit() < 0) {
            throw new ValidationException("limit must not be negative, got " + request.limit());
        }
        return jobTracker.submit(JobKind.EVALUATION, reporter -> evaluationService.runEvaluation(request, reporter));
    }

    public UUID submitIndexBuild() {
        return jobTracker.submit(JobKind.INDEX_BUILD, indexBuildService::buildIndex);
    }

    public JobSnapshot getJob(UUID jobId) {
        return jobTracker.getJob(jobId);
    }

    public Mono<JobSnapshot> awaitJob(UUID jobId) {
        return jobTracker.awaitTerminal(jobId);
    }

    public JobSnapshot cancelJob(UUID jobId) {
        return jobTracker.cancel(jobId);
    }
}
