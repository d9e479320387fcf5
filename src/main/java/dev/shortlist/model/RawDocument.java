package dev.shortlist.model;

/**
 * Full text of one candidate document with the relevance it was found with.
 */
public record RawDocument(String sourceName, String text, double similarity) {
}
