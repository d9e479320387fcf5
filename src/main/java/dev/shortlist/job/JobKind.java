package dev.shortlist.job;

public enum JobKind {
    INDEX_BUILD,
    EVALUATION
}
