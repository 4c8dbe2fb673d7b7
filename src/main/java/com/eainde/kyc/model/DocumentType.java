package com.eainde.kyc.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Identity documents accepted for verification.
 *
 * <p>The numeric {@link #code()} is a model feature. It must stay identical to the
 * encoding used when the classifier was trained, so never reorder or renumber these.</p>
 */
public enum DocumentType {
    AADHAR(0),
    PAN(1),
    UTILITY(2);

    private final int code;

    DocumentType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolves a user-supplied document type, ignoring case and surrounding whitespace.
     *
     * @return the matching type, or empty when the value is blank or not one of the supported types
     */
    public static Optional<DocumentType> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (DocumentType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
