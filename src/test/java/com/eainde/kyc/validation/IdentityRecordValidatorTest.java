package com.eainde.kyc.validation;

import com.eainde.kyc.exception.RecordValidationException;
import com.eainde.kyc.model.DocumentType;
import com.eainde.kyc.model.IdentityRecord;
import com.eainde.kyc.model.VerificationRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentityRecordValidatorTest {

    private final IdentityRecordValidator validator = new IdentityRecordValidator();

    @Test
    @DisplayName("accepts a complete request and normalises it")
    void accepts() {
        IdentityRecord record = validator.validate(
                new VerificationRequest(" John Doe ", "123456789012 ", "  12 Street ", "aadhar"));

        assertThat(record).isEqualTo(new IdentityRecord("John Doe", "123456789012", "12 Street", DocumentType.AADHAR));
    }

    @Test
    @DisplayName("a malformed document number is still accepted")
    void malformedNumberIsNotAViolation() {
        IdentityRecord record = validator.validate(new VerificationRequest("A", "???", null, "PAN"));

        assertThat(record.documentNumber()).isEqualTo("???");
        assertThat(record.address()).isEmpty();
    }

    @Test
    @DisplayName("reports every violation at once")
    void reportsAllViolations() {
        assertThatThrownBy(() -> validator.validate(new VerificationRequest(" ", null, "x", null)))
                .isInstanceOfSatisfying(RecordValidationException.class, e -> assertThat(e.getViolations())
                        .containsExactly("name is required", "documentNumber is required", "documentType is required"));
    }

    @Test
    @DisplayName("rejects unknown document types")
    void unknownType() {
        assertThatThrownBy(() -> validator.validate(new VerificationRequest("A", "1", "", "Passport")))
                .isInstanceOf(RecordValidationException.class)
                .hasMessageContaining("documentType 'Passport' is not one of [AADHAR, PAN, UTILITY]");
    }
}
