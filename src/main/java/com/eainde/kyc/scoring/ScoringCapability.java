package com.eainde.kyc.scoring;

/**
 * What the loaded artifacts allow, fixed when the bundle is assembled.
 */
public enum ScoringCapability {
    /** Selector, scaler and classifier all in use. */
    FULL,
    /** Classifier plus exactly one of selector or scaler. */
    PARTIAL,
    /** Classifier applied to the raw feature vector. */
    CLASSIFIER_ONLY,
    /** No usable classifier; prior evaluations or the safe default are used. */
    UNAVAILABLE
}
