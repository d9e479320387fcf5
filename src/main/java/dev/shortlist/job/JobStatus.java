package dev.shortlist.job;

public enum JobStatus {
    RUNNING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
