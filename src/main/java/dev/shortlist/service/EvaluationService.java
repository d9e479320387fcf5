package dev.shortlist.service;

import dev.shortlist.config.EvaluationConfig;
import dev.shortlist.exception.ValidationException;
import dev.shortlist.job.ProgressReporter;
import dev.shortlist.metrics.EvaluationMetrics;
import dev.shortlist.model.CandidateEvaluation;
import dev.shortlist.model.CandidateProfile;
import dev.shortlist.model.CandidateResolution;
import dev.shortlist.model.EvaluationRequest;
import dev.shortlist.model.EvaluationResult;
import dev.shortlist.model.JobRequirement;
import dev.shortlist.model.RankedEvaluation;
import dev.shortlist.model.RawDocument;
import dev.shortlist.model.RequirementHints;
import dev.shortlist.model.RetrievalMode;
import dev.shortlist.model.ScoreBreakdown;
import dev.shortlist.model.Shortlist;
import dev.shortlist.model.SoftSkillAssessment;
import dev.shortlist.model.TechnicalAssessment;
import dev.shortlist.scoring.ProfileScorer;
import dev.shortlist.scoring.SoftSkillScorer;
import dev.shortlist.scoring.TechnicalScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one evaluation end to end: requirement extraction, candidate
 * resolution, per-candidate extraction and scoring, then ranking. Progress is
 * reported by each stage as it does its work.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationService {

    private final RequirementExtractor requirementExtractor;
    private final CandidateResolver candidateResolver;
    private final ProfileExtractor profileExtractor;
    private final ProfileScorer profileScorer;
    private final TechnicalScorer technicalScorer;
    private final SoftSkillScorer softSkillScorer;
    private final DecisionAggregator decisionAggregator;
    private final EvaluationConfig evaluationConfig;
    private final EvaluationMetrics metrics;

    public JobRequirement extractRequirement(String jobText, RequirementHints hints) {
        return requirementExtractor.extract(jobText, hints);
    }

    public CandidateResolution resolveCandidates(JobRequirement requirement, RetrievalMode mode,
                                                 List<String> candidateIds, int limit) {
        return candidateResolver.resolve(requirement, mode, candidateIds, limit);
    }

    public CandidateEvaluation evaluateOne(RawDocument candidate, JobRequirement requirement) {
        return evaluateOne(candidate, "", requirement);
    }

    /**
     * Extract and score a single candidate. Does not rank.
     */
    public CandidateEvaluation evaluateOne(RawDocument candidate, String coverLetter, JobRequirement requirement) {
        CandidateProfile profile = profileExtractor.extract(candidate.text(), coverLetter, requirement);
        TechnicalAssessment technical = technicalScorer.assess(profile, requirement);
        SoftSkillAssessment softSkills = softSkillScorer.assess(profile);
        ScoreBreakdown breakdown = decisionAggregator.breakdown(
                profileScorer.score(profile, requirement), technical.score(), softSkills.score());
        log.debug("Scored {} ({}): profile={} technical={} softSkills={} global={}",
                profile.name(), candidate.sourceName(), breakdown.profile().score(),
                breakdown.technical().score(), breakdown.softSkill().score(), breakdown.globalScore());
        return new CandidateEvaluation(profile, breakdown, technical, softSkills,
                candidate.sourceName(), candidate.similarity());
    }

    public Shortlist rankAndReport(List<CandidateEvaluation> evaluations, JobRequirement requirement) {
        List<RankedEvaluation> ranking = decisionAggregator.rank(evaluations);
        return new Shortlist(ranking, decisionAggregator.report(ranking, requirement));
    }

    /**
     * The evaluation job body.
     *
     * @throws ValidationException if the job text is missing or the limit is negative
     */
    public EvaluationResult runEvaluation(EvaluationRequest request, ProgressReporter reporter) {
        if (request.jobText() == null || request.jobText().isBlank()) {
            throw new ValidationException("Job description text is required");
        }
        long started = System.nanoTime();

        reporter.report(5, "requirement", "Extracting job requirement");
        JobRequirement requirement = extractRequirement(request.jobText(), request.hints());
        reporter.report(10, "requirement", "Requirement extracted: " + requirement.title());

        int limit = request.limit() == 0 ? evaluationConfig.getDefaultLimit() : request.limit();
        reporter.report(10, "resolving", "Resolving candidates");
        CandidateResolution resolution = resolveCandidates(requirement, request.mode(), request.candidateIds(), limit);
        metrics.recordResolution(resolution.tier(), resolution.unmatchedIds().size());
        int total = resolution.documents().size();
        reporter.report(20, "resolving", String.format("Resolved %d candidates (%s)", total, resolution.tier()));

        List<CandidateEvaluation> evaluations = evaluateAll(resolution.documents(), request.coverLetters(),
                requirement, reporter);
        metrics.recordCandidatesEvaluated(evaluations.size());

        reporter.report(95, "ranking", "Ranking " + evaluations.size() + " candidates");
        Shortlist shortlist = rankAndReport(evaluations, requirement);
        metrics.updateLastRunStats(shortlist.ranking().size(),
                shortlist.ranking().isEmpty() ? 0 : shortlist.ranking().get(0).globalScore());
        metrics.recordEvaluationDuration(Duration.ofNanos(System.nanoTime() - started));

        log.info("Evaluation of '{}' done: {}", requirement.title(), shortlist.report().summary());
        return new EvaluationResult(requirement, shortlist.ranking(), shortlist.report(),
                resolution.tier(), resolution.unmatchedIds());
    }

    private List<CandidateEvaluation> evaluateAll(List<RawDocument> documents, Map<String, String> coverLetters,
                                                  JobRequirement requirement, ProgressReporter reporter) {
        if (documents.isEmpty()) {
            return List.of();
        }
        int total = documents.size();
        AtomicInteger done = new AtomicInteger();
        int parallelism = Math.max(1, evaluationConfig.getParallelism());

        List<CandidateEvaluation> evaluations = Flux.fromIterable(documents)
                .flatMapSequential(document -> Mono.fromCallable(
                                        () -> evaluateOne(document, coverLetterFor(document, coverLetters), requirement))
                                .subscribeOn(Schedulers.boundedElastic())
                                .doOnNext(evaluation -> {
                                    synchronized (done) {
                                        int count = done.incrementAndGet();
                                        reporter.report(20 + 70 * count / total, "evaluating",
                                                String.format("Evaluated %s (%d/%d)",
                                                        evaluation.profile().name(), count, total));
                                    }
                                }),
                        parallelism)
                .collectList()
                .block();
        return evaluations == null ? List.of() : evaluations;
    }

    private static String coverLetterFor(RawDocument document, Map<String, String> coverLetters) {
        String letter = coverLetters.get(document.sourceName());
        if (letter == null) {
            int dot = document.sourceName().lastIndexOf('.');
            letter = dot > 0 ? coverLetters.get(document.sourceName().substring(0, dot)) : null;
        }
        return letter == null ? "" : letter;
    }
}
