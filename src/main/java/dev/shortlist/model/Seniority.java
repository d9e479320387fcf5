package dev.shortlist.model;

public enum Seniority {
    JUNIOR,
    MID,
    SENIOR,
    UNSPECIFIED
}
