package com.eainde.kyc.risk;

import com.eainde.kyc.model.DocumentType;
import com.eainde.kyc.model.IdentityRecord;
import com.eainde.kyc.model.RiskLevel;
import com.eainde.kyc.model.RiskScore;
import com.eainde.kyc.model.VerificationDetails;
import com.eainde.kyc.model.VerificationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RiskClassifierTest {

    private final RiskClassifier classifier = new RiskClassifier();

    @Nested
    @DisplayName("classify()")
    class Classify {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "0.0,     LOW",
                "0.3299,  LOW",
                "0.33,    MEDIUM",
                "0.5,     MEDIUM",
                "0.67,    MEDIUM",
                "0.6701,  HIGH",
                "1.0,     HIGH"
        })
        void tiers(double probability, RiskLevel expected) {
            assertThat(classifier.classify(probability).riskLevel()).isEqualTo(expected);
        }

        @Test
        @DisplayName("33.00 and 67.00 are both Medium")
        void boundariesAreMedium() {
            assertThat(RiskClassifier.levelFor(new BigDecimal("33.00"))).isEqualTo(RiskLevel.MEDIUM);
            assertThat(RiskClassifier.levelFor(new BigDecimal("67.00"))).isEqualTo(RiskLevel.MEDIUM);
            assertThat(RiskClassifier.levelFor(new BigDecimal("32.99"))).isEqualTo(RiskLevel.LOW);
            assertThat(RiskClassifier.levelFor(new BigDecimal("67.01"))).isEqualTo(RiskLevel.HIGH);
        }

        @Test
        @DisplayName("rounds the percentage half-up to two decimals")
        void rounding() {
            RiskScore score = classifier.classify(0.123456);

            assertThat(score.fraudProbability()).isEqualByComparingTo("12.35");
            assertThat(score.fraudProbability().scale()).isEqualTo(2);
        }

        @ParameterizedTest
        @ValueSource(doubles = {0.0, 0.0001, 0.123456, 0.33, 0.5, 0.6789, 0.999999, 1.0})
        @DisplayName("confidence and probability always sum to 100")
        void confidenceComplementsProbability(double probability) {
            RiskScore score = classifier.classify(probability);

            assertThat(score.fraudProbability().add(score.confidence())).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("only High is flagged")
        void status() {
            assertThat(classifier.classify(0.9).status()).isEqualTo(VerificationStatus.FLAGGED);
            assertThat(classifier.classify(0.5).status()).isEqualTo(VerificationStatus.VERIFIED);
            assertThat(classifier.classify(0.1).status()).isEqualTo(VerificationStatus.VERIFIED);
        }

        @Test
        @DisplayName("out-of-range input is clamped and NaN is rejected")
        void outOfRange() {
            assertThat(classifier.classify(1.7).fraudProbability()).isEqualByComparingTo("100");
            assertThat(classifier.classify(-0.2).fraudProbability()).isEqualByComparingTo("0");
            assertThatThrownBy(() -> classifier.classify(Double.NaN))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("details()")
    class Details {

        @Test
        void suspiciousWhenHigh() {
            RiskScore score = classifier.classify(0.8);
            IdentityRecord record = new IdentityRecord("A", "123456789012", "short", DocumentType.AADHAR);

            VerificationDetails details = classifier.details(score, record);

            assertThat(details.documentAuthenticity()).isEqualTo("Suspicious");
            assertThat(details.addressVerification()).isEqualTo("Pending");
            assertThat(details.anomalyScore()).isEqualTo("80.00");
        }

        @Test
        void validWithLongAddress() {
            RiskScore score = classifier.classify(0.2);
            IdentityRecord record = new IdentityRecord("A", "123456789012", "12 Long Street Name", DocumentType.AADHAR);

            VerificationDetails details = classifier.details(score, record);

            assertThat(details.documentAuthenticity()).isEqualTo("Valid");
            assertThat(details.addressVerification()).isEqualTo("Verified");
        }
    }
}
