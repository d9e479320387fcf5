package dev.shortlist.model;

public enum ResolutionTier {
    EXPLICIT_IDS,
    SEMANTIC,
    ENUMERATION
}
