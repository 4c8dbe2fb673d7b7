package com.eainde.kyc.feature;

import com.eainde.kyc.model.FeatureVector;
import com.eainde.kyc.model.IdentityRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns an {@link IdentityRecord} into the fixed-order {@link FeatureVector} the classifier expects.
 *
 * <p>Extraction is a pure function and never throws. Odd input degrades to conservative values:
 * a blank address has zero words, and a document number the rules cannot judge counts as
 * not well-formed.</p>
 */
@Slf4j
@Component
public class FeatureExtractor {

    private final DocumentNumberRules documentNumberRules;

    public FeatureExtractor(DocumentNumberRules documentNumberRules) {
        this.documentNumberRules = documentNumberRules;
    }

    public FeatureVector extract(IdentityRecord record) {
        String name = nullToEmpty(record.name());
        String documentNumber = nullToEmpty(record.documentNumber());
        String address = nullToEmpty(record.address());

        double[] features = {
                name.length(),
                documentNumber.length(),
                address.length(),
                wordCount(address),
                record.documentType().code(),
                wellFormed(record, documentNumber) ? 1 : 0,
                name.chars().filter(Character::isUpperCase).count(),
                name.chars().filter(Character::isDigit).count()
        };
        return new FeatureVector(features);
    }

    private boolean wellFormed(IdentityRecord record, String documentNumber) {
        try {
            return documentNumberRules.isWellFormed(record.documentType(), documentNumber);
        } catch (RuntimeException e) {
            log.warn("Document-number rule for {} failed, treating number as malformed", record.documentType(), e);
            return false;
        }
    }

    private static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
