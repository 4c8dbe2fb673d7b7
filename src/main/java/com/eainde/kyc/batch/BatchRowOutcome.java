package com.eainde.kyc.batch;

import com.eainde.kyc.model.VerificationResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of one batch row: either a verification result or the reason the row failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchRowOutcome(
        int row,
        String name,
        String documentNumber,
        String documentType,
        VerificationResult result,
        String error
) {

    public static BatchRowOutcome success(BatchRow row, VerificationResult result) {
        return new BatchRowOutcome(row.rowIndex(), row.name(), row.documentNumber(), row.documentType(), result, null);
    }

    public static BatchRowOutcome failure(BatchRow row, String error) {
        return new BatchRowOutcome(row.rowIndex(), row.name(), row.documentNumber(), row.documentType(), null, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return result != null;
    }
}
