package com.eainde.kyc.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VerificationStatus {
    VERIFIED("Verified"),
    FLAGGED("Flagged");

    private final String label;

    VerificationStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
