package com.eainde.kyc.scoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Standardises each feature as {@code (x - mean) / scale}. A zero scale leaves the
 * centred value unscaled, matching how constant training columns are usually exported.
 *
 * <pre>{"mean": [...], "scale": [...]}</pre>
 */
public final class StandardScaler implements FeatureTransform {

    private final double[] mean;
    private final double[] scale;

    @JsonCreator
    public StandardScaler(@JsonProperty("mean") double[] mean,
                          @JsonProperty("scale") double[] scale) {
        if (mean == null || scale == null || mean.length == 0) {
            throw new IllegalArgumentException("Scaler needs non-empty mean and scale arrays");
        }
        if (mean.length != scale.length) {
            throw new IllegalArgumentException(
                    "Scaler mean has " + mean.length + " values but scale has " + scale.length);
        }
        this.mean = mean.clone();
        this.scale = scale.clone();
    }

    @Override
    public String stageName() {
        return "scaler";
    }

    @Override
    public int inputWidth() {
        return mean.length;
    }

    @Override
    public int outputWidth() {
        return mean.length;
    }

    @Override
    public double[] transform(double[] features) {
        if (features.length != mean.length) {
            throw new IllegalArgumentException(
                    "Scaler expects " + mean.length + " features but got " + features.length);
        }
        double[] scaled = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            double divisor = scale[i] == 0.0 ? 1.0 : scale[i];
            scaled[i] = (features[i] - mean[i]) / divisor;
        }
        return scaled;
    }

    @Override
    public String toString() {
        return "StandardScaler[width=" + mean.length + "]";
    }
}
