package com.eainde.kyc.model;

import java.io.Serializable;

/**
 * Display-oriented breakdown shown next to a verification result.
 */
public record VerificationDetails(
        String documentAuthenticity,
        String addressVerification,
        String anomalyScore
) implements Serializable {
}
