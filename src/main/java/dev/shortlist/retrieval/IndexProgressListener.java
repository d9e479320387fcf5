package dev.shortlist.retrieval;

/**
 * Receives index build milestones.
 */
@FunctionalInterface
public interface IndexProgressListener {

    void milestone(int progress, String step, String message);
}
