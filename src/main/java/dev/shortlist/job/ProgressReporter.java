package dev.shortlist.job;

/**
 * Handed to a job's worker so it can publish progress on its own entry.
 */
@FunctionalInterface
public interface ProgressReporter {

    /**
     * @param progress percentage in [0, 100]; values outside are clamped
     * @param step     short machine-readable stage name
     * @param message  human-readable description of the stage
     */
    void report(int progress, String step, String message);

    static ProgressReporter none() {
        return (progress, step, message) -> {
        };
    }
}
