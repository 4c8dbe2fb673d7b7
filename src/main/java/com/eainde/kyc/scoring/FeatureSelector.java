package com.eainde.kyc.scoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * Reduces and reorders a feature vector by picking columns by index.
 *
 * <pre>{"inputWidth": 8, "indices": [1, 5, 2, 3, 6, 7]}</pre>
 */
public final class FeatureSelector implements FeatureTransform {

    private final int inputWidth;
    private final int[] indices;

    @JsonCreator
    public FeatureSelector(@JsonProperty("inputWidth") int inputWidth,
                           @JsonProperty("indices") int[] indices) {
        if (inputWidth < 1) {
            throw new IllegalArgumentException("inputWidth must be >= 1");
        }
        if (indices == null || indices.length == 0) {
            throw new IllegalArgumentException("Feature selector needs at least one index");
        }
        for (int index : indices) {
            if (index < 0 || index >= inputWidth) {
                throw new IllegalArgumentException(
                        "Selector index " + index + " outside input width " + inputWidth);
            }
        }
        this.inputWidth = inputWidth;
        this.indices = indices.clone();
    }

    @Override
    public String stageName() {
        return "selector";
    }

    @Override
    public int inputWidth() {
        return inputWidth;
    }

    @Override
    public int outputWidth() {
        return indices.length;
    }

    @Override
    public double[] transform(double[] features) {
        if (features.length != inputWidth) {
            throw new IllegalArgumentException(
                    "Selector expects " + inputWidth + " features but got " + features.length);
        }
        double[] selected = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            selected[i] = features[indices[i]];
        }
        return selected;
    }

    @Override
    public String toString() {
        return "FeatureSelector" + Arrays.toString(indices);
    }
}
