package com.eainde.kyc.risk;

import com.eainde.kyc.model.IdentityRecord;
import com.eainde.kyc.model.RiskLevel;
import com.eainde.kyc.model.RiskScore;
import com.eainde.kyc.model.VerificationDetails;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Maps a fraud probability to a risk tier, status and confidence.
 *
 * <p>Tiers work on the percentage {@code p = probability * 100}, rounded to two decimals:</p>
 * <pre>
 *   p &lt; 33          Low
 *   33 &lt;= p &lt;= 67   Medium   (both bounds inclusive)
 *   p &gt; 67          High
 * </pre>
 * Confidence is {@code 100 - p}, computed in decimal arithmetic so the two always sum to 100.
 */
@Component
public class RiskClassifier {

    public static final BigDecimal MEDIUM_LOWER_BOUND = new BigDecimal("33");
    public static final BigDecimal MEDIUM_UPPER_BOUND = new BigDecimal("67");

    static final BigDecimal HUNDRED = new BigDecimal("100");
    static final int ADDRESS_VERIFIED_MIN_LENGTH = 10;

    public RiskScore classify(double probability) {
        if (Double.isNaN(probability)) {
            throw new IllegalArgumentException("Probability must be a number");
        }
        double bounded = Math.max(0.0, Math.min(1.0, probability));
        BigDecimal percentage = BigDecimal.valueOf(bounded)
                .multiply(HUNDRED)
                .setScale(2, RoundingMode.HALF_UP);
        RiskLevel level = levelFor(percentage);
        return new RiskScore(percentage, level, confidenceFor(percentage), level.status());
    }

    public static RiskLevel levelFor(BigDecimal percentage) {
        if (percentage.compareTo(MEDIUM_LOWER_BOUND) < 0) {
            return RiskLevel.LOW;
        }
        if (percentage.compareTo(MEDIUM_UPPER_BOUND) > 0) {
            return RiskLevel.HIGH;
        }
        return RiskLevel.MEDIUM;
    }

    public static BigDecimal confidenceFor(BigDecimal percentage) {
        BigDecimal confidence = HUNDRED.subtract(percentage);
        if (confidence.signum() < 0) {
            confidence = BigDecimal.ZERO;
        } else if (confidence.compareTo(HUNDRED) > 0) {
            confidence = HUNDRED;
        }
        return confidence.setScale(2, RoundingMode.HALF_UP);
    }

    public VerificationDetails details(RiskScore score, IdentityRecord record) {
        String address = record.address();
        return new VerificationDetails(
                authenticityFor(score.riskLevel()),
                address.length() > ADDRESS_VERIFIED_MIN_LENGTH ? "Verified" : "Pending",
                score.fraudProbability().setScale(2, RoundingMode.HALF_UP).toPlainString()
        );
    }

    public static String authenticityFor(RiskLevel level) {
        return level == RiskLevel.HIGH ? "Suspicious" : "Valid";
    }
}
