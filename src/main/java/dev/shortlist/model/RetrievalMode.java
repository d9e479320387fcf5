package dev.shortlist.model;

public enum RetrievalMode {
    SEMANTIC,
    EXHAUSTIVE
}
