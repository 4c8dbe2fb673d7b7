package com.eainde.kyc.scoring;

import lombok.Builder;

/**
 * The independently optional artifacts a bundle is assembled from. Any of them may be null.
 */
@Builder
public record ModelArtifacts(Classifier classifier, FeatureSelector selector, StandardScaler scaler) {

    public static ModelArtifacts none() {
        return new ModelArtifacts(null, null, null);
    }
}
