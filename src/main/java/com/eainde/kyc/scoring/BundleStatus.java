package com.eainde.kyc.scoring;

public record BundleStatus(
        ScoringCapability capability,
        boolean classifierLoaded,
        boolean selectorLoaded,
        boolean scalerLoaded,
        int priorEvaluations
) {
}
