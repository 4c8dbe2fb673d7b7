package com.eainde.kyc.batch;

import com.eainde.kyc.model.VerificationRequest;

/**
 * One data row of an uploaded batch file. {@code rowIndex} is 1-based and excludes the header.
 */
public record BatchRow(int rowIndex, String name, String documentNumber, String address, String documentType) {

    public VerificationRequest toRequest() {
        return new VerificationRequest(name, documentNumber, address, documentType);
    }
}
