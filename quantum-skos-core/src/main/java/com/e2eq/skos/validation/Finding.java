package com.e2eq.skos.validation;

/**
 * One validator output.
 */
public record Finding(Severity severity, FindingCategory category, String message) {

    public static Finding violation(FindingCategory category, String message) {
        return new Finding(Severity.VIOLATION, category, message);
    }

    public static Finding warning(FindingCategory category, String message) {
        return new Finding(Severity.WARNING, category, message);
    }

    public static Finding info(FindingCategory category, String message) {
        return new Finding(Severity.INFO, category, message);
    }

    @Override
    public String toString() {
        return message;
    }
}
