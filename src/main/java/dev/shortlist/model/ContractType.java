package dev.shortlist.model;

import dev.shortlist.exception.ValidationException;

import java.util.Locale;

/**
 * Contract types recognised in job descriptions. The code is the label used
 * on French job boards.
 */
public enum ContractType {
    PERMANENT("CDI"),
    FIXED_TERM("CDD"),
    INTERNSHIP("Stage"),
    APPRENTICESHIP("Alternance"),
    FREELANCE("Freelance");

    private final String code;

    ContractType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolve a caller-supplied hint by enum name or code, case-insensitively.
     *
     * @throws ValidationException when the hint names no known contract type
     */
    public static ContractType fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            throw new ValidationException("Contract type hint is blank");
        }
        String value = hint.trim();
        for (ContractType type : values()) {
            if (type.name().equalsIgnoreCase(value.replace('-', '_').replace(' ', '_'))
                    || type.code.toLowerCase(Locale.ROOT).equals(value.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new ValidationException("Unknown contract type: " + hint);
    }
}
