package com.eainde.kyc.scoring;

public enum ScoringSource {
    MODEL,
    PRIOR_EVALUATION,
    SAFE_DEFAULT
}
