package com.eainde.kyc.model;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * Risk judgment for one submission.
 *
 * @param fraudProbability fraud probability as a percentage in [0, 100], two decimal places
 * @param riskLevel        tier derived from {@code fraudProbability}
 * @param confidence       {@code 100 - fraudProbability}, two decimal places
 * @param status           derived from {@code riskLevel}
 */
public record RiskScore(
        BigDecimal fraudProbability,
        RiskLevel riskLevel,
        BigDecimal confidence,
        VerificationStatus status
) implements Serializable {
}
