package com.eainde.kyc.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum RiskLevel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Only high-risk submissions are flagged; everything else counts as verified.
     */
    public VerificationStatus status() {
        return this == HIGH ? VerificationStatus.FLAGGED : VerificationStatus.VERIFIED;
    }

    public static Optional<RiskLevel> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        for (RiskLevel level : values()) {
            if (level.label.equalsIgnoreCase(trimmed)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
