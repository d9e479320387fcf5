package dev.shortlist.retrieval;

import dev.shortlist.config.IndexConfig;
import dev.shortlist.exception.CollaboratorUnavailableException;
import dev.shortlist.model.RawDocument;
import dev.shortlist.pattern.KeywordMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Local retrieval index. Documents are cut into overlapping word windows and
 * each window is compared to the query by cosine similarity of term counts.
 * A build replaces the whole index at once, so searches never see a partial
 * index.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryChunkIndex implements RetrievalService, IndexBuilder {

    private static final Pattern WORD_SPLIT = Pattern.compile("\\s+");
    private static final Pattern TERM_SPLIT = Pattern.compile("[^\\p{L}\\p{N}+#]+");

    private final IndexConfig indexConfig;

    private volatile List<Chunk> chunks = List.of();

    @Override
    public IndexStats build(List<RawDocument> documents, IndexProgressListener listener) {
        listener.milestone(0, "chunking", "Chunking " + documents.size() + " documents");
        List<Chunk> built = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            RawDocument document = documents.get(i);
            built.addAll(chunk(document));
            int progress = 10 + (int) (80.0 * (i + 1) / documents.size());
            listener.milestone(progress, "chunking",
                    String.format("Indexed %s (%d/%d)", document.sourceName(), i + 1, documents.size()));
        }
        listener.milestone(95, "publishing", "Publishing " + built.size() + " chunks");
        chunks = List.copyOf(built);
        log.info("Index built: {} documents, {} chunks", documents.size(), built.size());
        return new IndexStats(documents.size(), built.size());
    }

    @Override
    public List<RetrievalHit> search(String query, int k) {
        List<Chunk> current = chunks;
        if (current.isEmpty()) {
            throw new CollaboratorUnavailableException("Retrieval index has not been built");
        }
        TermVector queryVector = TermVector.of(query);
        if (queryVector.norm() == 0 || k <= 0) {
            return List.of();
        }
        return current.stream()
                .map(chunk -> new RetrievalHit(chunk.source(), chunk.content(), chunk.vector().cosine(queryVector)))
                .filter(hit -> hit.similarity() > 0)
                .sorted(Comparator.comparingDouble(RetrievalHit::similarity).reversed())
                .limit(k)
                .toList();
    }

    @Override
    public boolean isReady() {
        return !chunks.isEmpty();
    }

    private List<Chunk> chunk(RawDocument document) {
        String[] words = WORD_SPLIT.split(document.text().trim());
        if (words.length == 0 || words[0].isEmpty()) {
            return List.of();
        }
        int size = Math.max(1, indexConfig.getChunkSize());
        int step = Math.max(1, size - Math.max(0, indexConfig.getChunkOverlap()));
        List<Chunk> result = new ArrayList<>();
        for (int start = 0; start < words.length; start += step) {
            String content = String.join(" ", Arrays.copyOfRange(words, start, Math.min(words.length, start + size)));
            result.add(new Chunk(document.sourceName(), content, TermVector.of(content)));
            if (start + size >= words.length) {
                break;
            }
        }
        return result;
    }

    private record Chunk(String source, String content, TermVector vector) {
    }

    private record TermVector(Map<String, Integer> counts, double norm) {

        static TermVector of(String text) {
            Map<String, Integer> counts = new HashMap<>();
            for (String term : TERM_SPLIT.split(KeywordMatcher.normalizeForMatching(text))) {
                if (!term.isEmpty()) {
                    counts.merge(term, 1, Integer::sum);
                }
            }
            double sum = counts.values().stream().mapToDouble(count -> (double) count * count).sum();
            return new TermVector(counts, Math.sqrt(sum));
        }

        double cosine(TermVector other) {
            if (norm == 0 || other.norm == 0) {
                return 0;
            }
            double dot = 0;
            for (Map.Entry<String, Integer> entry : other.counts.entrySet()) {
                Integer count = counts.get(entry.getKey());
                if (count != null) {
                    dot += (double) count * entry.getValue();
                }
            }
            return dot / (norm * other.norm);
        }
    }
}
