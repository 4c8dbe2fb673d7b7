package com.eainde.kyc.validation;

import com.eainde.kyc.exception.RecordValidationException;
import com.eainde.kyc.model.DocumentType;
import com.eainde.kyc.model.IdentityRecord;
import com.eainde.kyc.model.VerificationRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Gatekeeper between raw input and the scoring pipeline. Name and document number are
 * trimmed; the address defaults to empty.
 */
@Component
public class IdentityRecordValidator {

    public IdentityRecord validate(VerificationRequest request) {
        if (request == null) {
            throw new RecordValidationException(List.of("request is required"));
        }
        List<String> violations = new ArrayList<>();
        String name = trimToEmpty(request.name());
        String documentNumber = trimToEmpty(request.documentNumber());

        if (name.isEmpty()) {
            violations.add("name is required");
        }
        if (documentNumber.isEmpty()) {
            violations.add("documentNumber is required");
        }
        Optional<DocumentType> documentType = DocumentType.fromValue(request.documentType());
        if (documentType.isEmpty()) {
            violations.add(request.documentType() == null || request.documentType().isBlank()
                    ? "documentType is required"
                    : "documentType '" + request.documentType().trim() + "' is not one of "
                            + Arrays.toString(DocumentType.values()));
        }

        if (!violations.isEmpty()) {
            throw new RecordValidationException(violations);
        }
        String address = request.address() == null ? "" : request.address().trim();
        return new IdentityRecord(name, documentNumber, address, documentType.get());
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
