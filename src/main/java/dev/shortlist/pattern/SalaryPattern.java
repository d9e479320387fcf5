package dev.shortlist.pattern;

import java.util.regex.Pattern;

/**
 * Salary regex applied to whitespace-free lowercase text. Group 1 is the first
 * amount and group 2 its optional {@code k}; a range pattern adds groups 3 and 4
 * for the upper bound.
 */
public record SalaryPattern(Pattern pattern, boolean range) {
}
