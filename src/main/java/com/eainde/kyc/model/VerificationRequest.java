package com.eainde.kyc.model;

import java.io.Serializable;

/**
 * Raw, unvalidated verification input as received from a form submission or a batch row.
 */
public record VerificationRequest(
        String name,
        String documentNumber,
        String address,
        String documentType
) implements Serializable {
}
