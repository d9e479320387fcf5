package dev.shortlist.job;

/**
 * The body of a tracked job. The returned value becomes the job result.
 */
@FunctionalInterface
public interface JobWork {

    Object run(ProgressReporter reporter) throws Exception;
}
