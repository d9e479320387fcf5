package dev.shortlist.service;

import dev.shortlist.config.EvaluationConfig;
import dev.shortlist.job.ProgressReporter;
import dev.shortlist.model.RawDocument;
import dev.shortlist.retrieval.DocumentStore;
import dev.shortlist.retrieval.IndexBuilder;
import dev.shortlist.retrieval.IndexStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Body of an index build job: loads every stored document and hands them to
 * the index builder, whose milestones become the job's progress.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexBuildService {

    private final DocumentStore documentStore;
    private final IndexBuilder indexBuilder;
    private final EvaluationConfig evaluationConfig;

    public IndexStats buildIndex(ProgressReporter reporter) {
        List<String> names = documentStore.list(evaluationConfig.getExtensions());
        reporter.report(0, "loading", "Loading " + names.size() + " documents");

        List<RawDocument> documents = new ArrayList<>(names.size());
        for (String name : names) {
            try {
                documents.add(new RawDocument(name, documentStore.read(name), 1.0));
            } catch (IOException e) {
                log.warn("Skipping unreadable document {}: {}", name, e.getMessage());
            }
        }
        return indexBuilder.build(documents, reporter::report);
    }
}
