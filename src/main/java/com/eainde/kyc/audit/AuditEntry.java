package com.eainde.kyc.audit;

import com.eainde.kyc.model.RiskLevel;
import com.eainde.kyc.model.VerificationResult;
import com.eainde.kyc.model.VerificationStatus;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One durable line of the audit log. Status is not stored: it is always recomputed from
 * {@link #riskLevel()}.
 */
public record AuditEntry(
        Instant timestamp,
        String name,
        String documentNumber,
        String idType,
        BigDecimal fraudProbability,
        RiskLevel riskLevel,
        BigDecimal confidence
) {

    public static AuditEntry from(VerificationResult result) {
        return new AuditEntry(
                result.timestamp(),
                result.name(),
                result.documentNumber(),
                result.documentType(),
                result.fraudProbability(),
                result.riskLevel(),
                result.confidence()
        );
    }

    public VerificationStatus status() {
        return riskLevel.status();
    }
}
