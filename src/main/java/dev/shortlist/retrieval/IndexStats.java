package dev.shortlist.retrieval;

public record IndexStats(int documents, int chunks) {
}
