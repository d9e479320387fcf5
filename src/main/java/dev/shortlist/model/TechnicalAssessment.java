package dev.shortlist.model;

import java.util.List;

public record TechnicalAssessment(
        CriterionScore score,
        List<String> matchedSkills,
        List<String> missingSkills,
        List<String> optionalMatched) {

    public TechnicalAssessment {
        matchedSkills = List.copyOf(matchedSkills);
        missingSkills = List.copyOf(missingSkills);
        optionalMatched = List.copyOf(optionalMatched);
    }
}
