package dev.shortlist.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Recommendation {
    STRONGLY_RECOMMENDED("strongly_recommended", "Strongly recommended"),
    RECOMMENDED("recommended", "Recommended"),
    TO_CONSIDER("to_consider", "To consider"),
    TO_REJECT("to_reject", "Not recommended");

    private final String wireName;
    private final String label;

    Recommendation(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getLabel() {
        return label;
    }
}
