package dev.shortlist.service;

import dev.shortlist.config.ScoringConfig;
import dev.shortlist.model.CandidateEvaluation;
import dev.shortlist.model.CriterionScore;
import dev.shortlist.model.EvaluationReport;
import dev.shortlist.model.JobRequirement;
import dev.shortlist.model.RankedEvaluation;
import dev.shortlist.model.Recommendation;
import dev.shortlist.model.ReportStatistics;
import dev.shortlist.model.ScoreBreakdown;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Locale;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Combines the three criterion scores into a global score, a recommendation
 * and a justification, then ranks candidates and summarises the run.
 */
@Service
@RequiredArgsConstructor
public class DecisionAggregator {

    private static final int RATIONALE_EXCERPT = 120;

    private final ScoringConfig scoringConfig;

    /**
     * Weighted sum of the three criteria, rounded to two decimals.
     */
    public double globalScore(double profile, double technical, double softSkill) {
        double weighted = scoringConfig.getProfileWeight() * profile
                + scoringConfig.getTechnicalWeight() * technical
                + scoringConfig.getSoftSkillWeight() * softSkill;
        return round(weighted);
    }

    public ScoreBreakdown breakdown(CriterionScore profile, CriterionScore technical, CriterionScore softSkill) {
        return new ScoreBreakdown(profile, technical, softSkill,
                globalScore(profile.score(), technical.score(), softSkill.score()));
    }

    public Recommendation recommend(double globalScore) {
        if (globalScore >= scoringConfig.getStronglyRecommendedThreshold()) {
            return Recommendation.STRONGLY_RECOMMENDED;
        }
        if (globalScore >= scoringConfig.getRecommendedThreshold()) {
            return Recommendation.RECOMMENDED;
        }
        if (globalScore >= scoringConfig.getToConsiderThreshold()) {
            return Recommendation.TO_CONSIDER;
        }
        return Recommendation.TO_REJECT;
    }

    /**
     * Sort by global score, highest first. Equal scores keep their input order.
     */
    public List<RankedEvaluation> rank(List<CandidateEvaluation> evaluations) {
        List<CandidateEvaluation> sorted = new ArrayList<>(evaluations);
        sorted.sort(Comparator.comparingDouble(CandidateEvaluation::globalScore).reversed());

        List<RankedEvaluation> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            CandidateEvaluation evaluation = sorted.get(i);
            Recommendation recommendation = recommend(evaluation.globalScore());
            ranked.add(new RankedEvaluation(i + 1, evaluation, recommendation,
                    justify(evaluation, recommendation)));
        }
        return ranked;
    }

    public String justify(CandidateEvaluation evaluation, Recommendation recommendation) {
        ScoreBreakdown breakdown = evaluation.breakdown();
        StringBuilder text = new StringBuilder();
        text.append("Candidate: ").append(evaluation.profile().name());
        if (evaluation.sourceName() != null && !evaluation.sourceName().isBlank()) {
            text.append(" (").append(evaluation.sourceName()).append(')');
        }
        text.append('\n')
                .append(String.format(Locale.ROOT, "Global score: %.2f/100\n", breakdown.globalScore()))
                .append("Recommendation: ").append(recommendation.getLabel()).append('\n')
                .append(criterionLine("Profile", breakdown.profile()))
                .append(criterionLine("Technical", breakdown.technical()))
                .append(criterionLine("Soft skills", breakdown.softSkill()));

        List<String> strengths = new ArrayList<>();
        List<String> improvements = new ArrayList<>();
        classify("Profile fit", breakdown.profile(), strengths, improvements);
        classify("Technical skills", breakdown.technical(), strengths, improvements);
        classify("Soft skills", breakdown.softSkill(), strengths, improvements);

        if (!strengths.isEmpty()) {
            text.append("Strengths:\n");
            strengths.forEach(line -> text.append("- ").append(line).append('\n'));
        }
        if (!improvements.isEmpty()) {
            text.append("Areas to improve:\n");
            improvements.forEach(line -> text.append("- ").append(line).append('\n'));
        }
        return text.toString().trim();
    }

    /**
     * Statistics over every ranked candidate plus the configured number of top
     * candidates.
     */
    public EvaluationReport report(List<RankedEvaluation> ranked, JobRequirement requirement) {
        if (ranked.isEmpty()) {
            return EvaluationReport.empty(requirement);
        }
        DoubleSummaryStatistics global = summarize(ranked, RankedEvaluation::globalScore);
        DoubleSummaryStatistics profile = summarize(ranked, r -> r.breakdown().profile().score());
        DoubleSummaryStatistics technical = summarize(ranked, r -> r.breakdown().technical().score());
        DoubleSummaryStatistics softSkill = summarize(ranked, r -> r.breakdown().softSkill().score());
        ReportStatistics statistics = new ReportStatistics(
                ranked.size(),
                round(global.getAverage()), global.getMax(), global.getMin(),
                round(profile.getAverage()), profile.getMax(), profile.getMin(),
                round(technical.getAverage()), technical.getMax(), technical.getMin(),
                round(softSkill.getAverage()), softSkill.getMax(), softSkill.getMin());
        List<RankedEvaluation> top = ranked.subList(0, Math.min(scoringConfig.getTopCandidates(), ranked.size()));
        return new EvaluationReport(summary(ranked, top, statistics, requirement), statistics, top, requirement);
    }

    private String summary(List<RankedEvaluation> ranked, List<RankedEvaluation> top,
                           ReportStatistics statistics, JobRequirement requirement) {
        long shortlisted = ranked.stream()
                .filter(r -> r.recommendation() == Recommendation.STRONGLY_RECOMMENDED
                        || r.recommendation() == Recommendation.RECOMMENDED)
                .count();
        String title = requirement == null ? JobRequirement.UNSPECIFIED : requirement.title();
        String topList = top.stream()
                .map(r -> String.format(Locale.ROOT, "%d. %s (%.2f)", r.rank(), r.profile().name(), r.globalScore()))
                .collect(Collectors.joining(", "));
        return String.format(Locale.ROOT,
                "%d candidates evaluated for '%s'. Mean global score %.2f (max %.2f, min %.2f). "
                        + "%d recommended. Top candidates: %s",
                statistics.count(), title, statistics.meanGlobal(), statistics.maxGlobal(),
                statistics.minGlobal(), shortlisted, topList);
    }

    private void classify(String criterion, CriterionScore score, List<String> strengths, List<String> improvements) {
        String line = String.format(Locale.ROOT, "%s (%.1f/100)", criterion, score.score());
        if (score.score() >= scoringConfig.getStrengthThreshold()) {
            strengths.add(line);
        } else if (score.score() < scoringConfig.getImprovementThreshold()) {
            improvements.add(line);
        }
    }

    private static String criterionLine(String label, CriterionScore score) {
        String rationale = score.rationale();
        if (rationale.length() > RATIONALE_EXCERPT) {
            rationale = rationale.substring(0, RATIONALE_EXCERPT) + "...";
        }
        return String.format(Locale.ROOT, "%s: %.1f/100 - %s\n", label, score.score(), rationale);
    }

    private static DoubleSummaryStatistics summarize(List<RankedEvaluation> ranked,
                                                     ToDoubleFunction<RankedEvaluation> value) {
        return ranked.stream().mapToDouble(value).summaryStatistics();
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
