package com.netforge.core.builder;

import java.util.Objects;

/**
 * A problem found in a built netlist.
 *
 * @param severity how serious the problem is
 * @param code stable identifier of the check that failed
 * @param subject refdes, net or pin the problem concerns
 * @param message human-readable description
 */
public record ValidationIssue(
    Severity severity,
    String code,
    String subject,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationIssue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(code, "code must not be null");
        if (subject == null) {
            subject = "";
        }
        Objects.requireNonNull(message, "message must not be null");
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Severity of a validation issue.
     */
    public enum Severity {
        /** The netlist breaks one of its structural guarantees */
        ERROR,

        /** The netlist is consistent but probably not what was drawn */
        WARNING
    }
}
