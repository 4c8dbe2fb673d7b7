package com.eainde.kyc.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Outcome of scoring one identity submission. Created once, returned to the caller and
 * persisted to the audit log; never modified afterwards.
 *
 * <p>{@code documentType} is kept as text because history entries may carry document
 * types that are no longer accepted for new submissions.</p>
 */
public record VerificationResult(
        String id,
        Instant timestamp,
        String name,
        String documentNumber,
        String address,
        String documentType,
        BigDecimal fraudProbability,
        RiskLevel riskLevel,
        BigDecimal confidence,
        VerificationStatus status,
        VerificationDetails details,
        String message,
        boolean degraded
) implements Serializable {

    public static final String PROCESSED_MESSAGE = "KYC processed successfully.";
    public static final String HISTORY_MESSAGE = "Loaded from audit log.";

    public static VerificationResult of(String id,
                                        Instant timestamp,
                                        IdentityRecord record,
                                        RiskScore score,
                                        VerificationDetails details,
                                        boolean degraded) {
        return new VerificationResult(
                id,
                timestamp,
                record.name(),
                record.documentNumber(),
                record.address(),
                record.documentType().name(),
                score.fraudProbability(),
                score.riskLevel(),
                score.confidence(),
                score.status(),
                details,
                PROCESSED_MESSAGE,
                degraded
        );
    }
}
