package com.eainde.kyc.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed-order numeric encoding of an {@link IdentityRecord}, the raw input of the classifier.
 *
 * <p>The order of {@link #FEATURE_NAMES} is part of the contract with the trained model
 * artifacts and must not change.</p>
 */
public final class FeatureVector implements Serializable {

    public static final List<String> FEATURE_NAMES = List.of(
            "name_length",
            "document_number_length",
            "address_length",
            "address_word_count",
            "document_type_code",
            "document_number_well_formed",
            "name_uppercase_count",
            "name_digit_count"
    );

    public static final int WIDTH = FEATURE_NAMES.size();

    private final double[] values;

    public FeatureVector(double[] values) {
        if (values == null || values.length != WIDTH) {
            throw new IllegalArgumentException("Feature vector must have exactly " + WIDTH + " values");
        }
        this.values = values.clone();
    }

    public double get(int index) {
        return values[index];
    }

    public int width() {
        return values.length;
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector other)) return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
