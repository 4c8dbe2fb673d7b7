package com.eainde.kyc.feature;

import com.eainde.kyc.config.KycProperties;
import com.eainde.kyc.model.DocumentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * Registry of per-type document-number validators.
 *
 * <p>Defaults:</p>
 * <ul>
 *   <li>AADHAR: 12 digits</li>
 *   <li>PAN: 5 letters, 4 digits, 1 letter (upper case)</li>
 *   <li>UTILITY: 6 to 20 alphanumerics</li>
 * </ul>
 * Any default can be replaced through {@code kyc.features.document-patterns}.
 */
@Slf4j
@Component
public class DocumentNumberRules {

    static final Map<DocumentType, String> DEFAULT_PATTERNS = Map.of(
            DocumentType.AADHAR, "\\d{12}",
            DocumentType.PAN, "[A-Z]{5}\\d{4}[A-Z]",
            DocumentType.UTILITY, "[A-Za-z0-9]{6,20}"
    );

    private final Map<DocumentType, DocumentNumberValidator> validators;

    @Autowired
    public DocumentNumberRules(KycProperties properties) {
        this(properties.getFeatures().getDocumentPatterns());
    }

    public DocumentNumberRules(Map<DocumentType, String> overrides) {
        Map<DocumentType, DocumentNumberValidator> resolved = new EnumMap<>(DocumentType.class);
        for (DocumentType type : DocumentType.values()) {
            String regex = overrides != null && overrides.containsKey(type)
                    ? overrides.get(type)
                    : DEFAULT_PATTERNS.get(type);
            try {
                resolved.put(type, new PatternDocumentNumberValidator(regex));
            } catch (PatternSyntaxException e) {
                throw new IllegalStateException("Invalid document-number pattern for " + type + ": " + regex, e);
            }
        }
        this.validators = Collections.unmodifiableMap(resolved);
        log.info("Document-number rules: {}", validators);
    }

    public DocumentNumberValidator validatorFor(DocumentType type) {
        return validators.get(type);
    }

    public boolean isWellFormed(DocumentType type, String documentNumber) {
        return validatorFor(type).isWellFormed(documentNumber);
    }
}
