package com.eainde.kyc.exception;

import java.util.List;

/**
 * Thrown when a submission is rejected before any scoring takes place.
 */
public class RecordValidationException extends KycException {

    private final List<String> violations;

    public RecordValidationException(List<String> violations) {
        super("Invalid verification request: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
