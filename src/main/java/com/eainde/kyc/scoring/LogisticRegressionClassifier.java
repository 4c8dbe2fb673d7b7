package com.eainde.kyc.scoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Logistic regression: {@code sigmoid(w . x + b)}.
 *
 * <pre>{"type": "logistic-regression", "weights": [...], "intercept": -1.2}</pre>
 */
public final class LogisticRegressionClassifier implements Classifier {

    private final double[] weights;
    private final double intercept;

    @JsonCreator
    public LogisticRegressionClassifier(@JsonProperty("weights") double[] weights,
                                        @JsonProperty("intercept") double intercept) {
        if (weights == null || weights.length == 0) {
            throw new IllegalArgumentException("Classifier needs at least one weight");
        }
        for (double weight : weights) {
            if (!Double.isFinite(weight)) {
                throw new IllegalArgumentException("Classifier weights must be finite");
            }
        }
        if (!Double.isFinite(intercept)) {
            throw new IllegalArgumentException("Classifier intercept must be finite");
        }
        this.weights = weights.clone();
        this.intercept = intercept;
    }

    @Override
    public int inputWidth() {
        return weights.length;
    }

    @Override
    public double predictProbability(double[] features) {
        if (features.length != weights.length) {
            throw new IllegalArgumentException(
                    "Classifier expects " + weights.length + " features but got " + features.length);
        }
        double z = intercept;
        for (int i = 0; i < weights.length; i++) {
            z += weights[i] * features[i];
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }

    @Override
    public String toString() {
        return "LogisticRegressionClassifier[width=" + weights.length + "]";
    }
}
