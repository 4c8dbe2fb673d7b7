package com.eainde.kyc.scoring;

/**
 * A preprocessing step applied to the feature vector before classification.
 * Implementations are immutable and safe to share between threads.
 */
public interface FeatureTransform {

    /**
     * Short label used when reporting intermediate values, e.g. {@code selector}.
     */
    String stageName();

    int inputWidth();

    int outputWidth();

    double[] transform(double[] features);
}
