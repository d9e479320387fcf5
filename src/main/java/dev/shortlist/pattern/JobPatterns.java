package dev.shortlist.pattern;

import dev.shortlist.model.ContractType;
import dev.shortlist.model.Seniority;
import lombok.Builder;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tables read by the requirement extractor.
 *
 * @param titles               known job titles, first match wins
 * @param seniority            seniority keyword groups in checking order
 * @param experiencePatterns   regexes whose group 1 is a number of years
 * @param experienceRange      regex whose groups 1 and 2 are a min and max
 * @param requiredSections     line-start markers opening a required-skills section
 * @param optionalSections     line-start markers opening an optional-skills section
 * @param otherSections        line-start markers opening any other section
 * @param requiredContext      keywords marking a skill as required in its clause
 * @param optionalContext      keywords marking a skill as optional in its clause
 * @param locations            location keyword to display name
 * @param locationLine         explicit "Location: X" line, group 1 is the value
 * @param salaryPatterns       salary regexes, first match wins
 * @param contracts            contract keyword groups in checking order
 * @param stopwords            words ignored by keyword extraction
 */
@Builder
public record JobPatterns(
        List<String> titles,
        Map<Seniority, List<String>> seniority,
        List<Pattern> experiencePatterns,
        Pattern experienceRange,
        List<String> requiredSections,
        List<String> optionalSections,
        List<String> otherSections,
        List<String> requiredContext,
        List<String> optionalContext,
        Map<String, String> locations,
        Pattern locationLine,
        List<SalaryPattern> salaryPatterns,
        Map<ContractType, List<String>> contracts,
        Set<String> stopwords) {
}
