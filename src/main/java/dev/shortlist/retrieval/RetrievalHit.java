package dev.shortlist.retrieval;

/**
 * One matching chunk. The similarity is an opaque relevance score: higher is
 * more relevant, and it is not a probability.
 */
public record RetrievalHit(String source, String content, double similarity) {
}
