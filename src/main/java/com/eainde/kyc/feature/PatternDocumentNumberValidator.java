package com.eainde.kyc.feature;

import java.util.regex.Pattern;

/**
 * Accepts document numbers that fully match a regular expression.
 */
public class PatternDocumentNumberValidator implements DocumentNumberValidator {

    private final Pattern pattern;

    public PatternDocumentNumberValidator(String regex) {
        this.pattern = Pattern.compile(regex);
    }

    @Override
    public boolean isWellFormed(String documentNumber) {
        if (documentNumber == null || documentNumber.isBlank()) {
            return false;
        }
        return pattern.matcher(documentNumber.trim()).matches();
    }

    @Override
    public String toString() {
        return "PatternDocumentNumberValidator[" + pattern.pattern() + "]";
    }
}
