package dev.shortlist.pattern;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Versioned keyword and regex tables used by the extractors and scorers.
 * Tables are grouped by consumer so an implementation can be swapped (or a
 * language added) without touching the code that reads them.
 */
public interface PatternLibrary {

    /**
     * Version of the tables, reported with every evaluation.
     */
    String version();

    /**
     * Skill vocabulary in the order occurrences are reported.
     */
    List<SkillDefinition> skills();

    /**
     * Canonical keys of the skills treated as required when a job text has no
     * skill section and no local context says otherwise.
     */
    Set<String> coreSkills();

    /**
     * Display name of a language mapped to the keywords that reveal it.
     */
    Map<String, List<String>> languages();

    JobPatterns job();

    ResumePatterns resume();

    SoftSkillPatterns softSkills();
}
