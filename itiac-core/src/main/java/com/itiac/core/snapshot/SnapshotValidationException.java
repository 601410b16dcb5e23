package com.itiac.core.snapshot;

import java.util.List;

/**
 * Thrown when a snapshot document is missing required fields or holds values the model does
 * not know. Carries every violation found, not just the first one.
 */
public class SnapshotValidationException extends RuntimeException {

    private final List<String> violations;

    public SnapshotValidationException(List<String> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * Returns the violations, each prefixed with the path of the offending field.
     *
     * @return violations
     */
    public List<String> violations() {
        return violations;
    }

    private static String buildMessage(List<String> violations) {
        return "Invalid snapshot (" + violations.size() + " violation(s)): " + String.join("; ", violations);
    }
}
