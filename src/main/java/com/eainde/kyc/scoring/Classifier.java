package com.eainde.kyc.scoring;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A trained binary fraud classifier, loaded read-only from an exported artifact.
 * The artifact's {@code type} property selects the implementation.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LogisticRegressionClassifier.class, name = "logistic-regression")
})
public interface Classifier {

    int inputWidth();

    /**
     * @return probability of the fraud class, expected in [0, 1]
     */
    double predictProbability(double[] features);
}
