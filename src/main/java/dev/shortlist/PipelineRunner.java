package dev.shortlist;

import dev.shortlist.exception.CollaboratorUnavailableException;
import dev.shortlist.job.JobSnapshot;
import dev.shortlist.job.JobStatus;
import dev.shortlist.model.EvaluationRequest;
import dev.shortlist.model.EvaluationResult;
import dev.shortlist.model.QueryAnswer;
import dev.shortlist.model.RankedEvaluation;
import dev.shortlist.model.RetrievalMode;
import dev.shortlist.report.ReportRenderer;
import dev.shortlist.service.CandidateQueryService;
import dev.shortlist.service.ShortlistJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Orchestrates one command-line run: optional index build, the evaluation
 * job, the HTML report and an optional question about the candidates.
 * Separated from the main Application class for better testability and SRP.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private static final String SEPARATOR = "========================================";

  private final ShortlistJobService jobService;
  private final CandidateQueryService queryService;
  private final ReportRenderer reportRenderer;

  @Value("${shortlist.run.job-file:}")
  private String jobFile;

  @Value("${shortlist.run.candidate-ids:}")
  private String candidateIds;

  @Value("${shortlist.run.use-retrieval:true}")
  private boolean useRetrieval;

  @Value("${shortlist.run.limit:10}")
  private int limit;

  @Value("${shortlist.run.build-index:true}")
  private boolean buildIndex;

  @Value("${shortlist.run.report-output:}")
  private String reportOutput;

  @Value("${shortlist.run.question:}")
  private String question;

  @Value("${shortlist.run.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * Runs the configured evaluation and waits for it to finish.
   *
   * @return Number of candidates ranked
   */
  public int execute() {
    log.info(SEPARATOR);
    log.info("Candidate Shortlist Starting");
    log.info(SEPARATOR);

    if (jobFile == null || jobFile.isBlank()) {
      log.info("No job description configured (shortlist.run.job-file), nothing to evaluate");
      return 0;
    }

    try {
      String jobText = Files.readString(Path.of(jobFile), StandardCharsets.UTF_8);

      if (buildIndex) {
        buildIndex();
      }

      UUID jobId = jobService.submitEvaluation(EvaluationRequest.builder()
          .jobText(jobText)
          .candidateIds(parseIds(candidateIds))
          .mode(useRetrieval ? RetrievalMode.SEMANTIC : RetrievalMode.EXHAUSTIVE)
          .limit(limit)
          .build());
      JobSnapshot snapshot = jobService.awaitJob(jobId).block();
      if (snapshot == null || snapshot.status() != JobStatus.COMPLETED) {
        String reason = snapshot == null ? "no result" : snapshot.error();
        throw new IllegalStateException("Evaluation job " + jobId + " failed: " + reason);
      }

      EvaluationResult result = snapshot.resultAs(EvaluationResult.class);
      logResult(result);

      if (reportOutput != null && !reportOutput.isBlank()) {
        reportRenderer.write(result, Path.of(reportOutput));
      }
      if (question != null && !question.isBlank()) {
        askQuestion();
      }

      log.info(SEPARATOR);
      log.info("Candidate Shortlist Completed Successfully");
      log.info("Candidates ranked: {}", result.ranking().size());
      log.info(SEPARATOR);

      handleMetricsWait();

      return result.ranking().size();
    } catch (Exception e) {
      log.error("Candidate Shortlist failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Pipeline execution failed", e);
    }
  }

  private void buildIndex() {
    UUID indexJob = jobService.submitIndexBuild();
    JobSnapshot snapshot = jobService.awaitJob(indexJob).block();
    if (snapshot == null || snapshot.status() != JobStatus.COMPLETED) {
      log.warn("Index build failed ({}), candidates will be enumerated",
          snapshot == null ? "no result" : snapshot.error());
    } else {
      log.info("Index build finished: {}", snapshot.result());
    }
  }

  private void logResult(EvaluationResult result) {
    log.info("Position: {} ({} to {} years, {})", result.requirement().title(),
        result.requirement().experienceMin(), result.requirement().experienceMax(),
        result.requirement().contractType().getCode());
    log.info("Required skills: {} | Optional skills: {}",
        result.requirement().requiredSkillLabels(), result.requirement().optionalSkillLabels());
    log.info("Candidates resolved by {}", result.tier());
    if (!result.unmatchedIds().isEmpty()) {
      log.warn("Unmatched candidate ids: {}", result.unmatchedIds());
    }
    for (RankedEvaluation entry : result.ranking()) {
      log.info("#{} {} - {} - {}", entry.rank(), entry.profile().name(),
          String.format("%.2f", entry.globalScore()), entry.recommendation().getLabel());
      log.debug("{}", entry.justification());
    }
    log.info(result.report().summary());
  }

  private void askQuestion() {
    try {
      QueryAnswer answer = queryService.ask(question, limit).block();
      if (answer != null) {
        log.info("Q: {}", question);
        log.info("A ({}): {}", answer.provider(), answer.answer());
      }
    } catch (CollaboratorUnavailableException e) {
      log.warn("Cannot answer question: {}", e.getMessage());
    }
  }

  static List<String> parseIds(String ids) {
    if (ids == null || ids.isBlank()) {
      return List.of();
    }
    return Arrays.stream(ids.split(","))
        .map(String::trim)
        .filter(id -> !id.isEmpty())
        .toList();
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
