package dev.shortlist.model;

/**
 * Mean, max and min of the global score and of each criterion over one run.
 */
public record ReportStatistics(
        int count,
        double meanGlobal,
        double maxGlobal,
        double minGlobal,
        double meanProfile,
        double maxProfile,
        double minProfile,
        double meanTechnical,
        double maxTechnical,
        double minTechnical,
        double meanSoftSkill,
        double maxSoftSkill,
        double minSoftSkill) {

    public static final ReportStatistics EMPTY = new ReportStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    public boolean isEmpty() {
        return count == 0;
    }
}
