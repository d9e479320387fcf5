package dev.shortlist.model;

/**
 * One professional experience entry read from a résumé. An entry with neither
 * an end year nor an ongoing marker cannot be dated and counts for nothing.
 * An inverted span yields a negative duration; only the profile total is floored.
 */
public record Experience(String title, int startYear, Integer endYear, boolean ongoing) {

    public boolean isParsable() {
        return endYear != null || ongoing;
    }

    public int years(int currentYear) {
        if (!isParsable()) {
            return 0;
        }
        int end = ongoing ? currentYear : endYear;
        return end - startYear;
    }
}
