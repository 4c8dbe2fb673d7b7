package com.eainde.kyc.scoring;

import java.io.Serializable;

/**
 * Fraud probability in [0, 1] together with where it came from.
 */
public record ScoringOutcome(double probability, ScoringSource source) implements Serializable {

    public boolean degraded() {
        return source != ScoringSource.MODEL;
    }
}
