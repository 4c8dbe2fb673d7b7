package com.eainde.kyc.scoring;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Fraud probabilities computed earlier by an external model, keyed by document number.
 * Consulted only when no classifier can score a record.
 */
public final class PriorEvaluationStore {

    private static final PriorEvaluationStore EMPTY = new PriorEvaluationStore(Map.of());

    private final Map<String, Double> probabilities;

    public PriorEvaluationStore(Map<String, Double> probabilities) {
        this.probabilities = Map.copyOf(probabilities);
    }

    public static PriorEvaluationStore empty() {
        return EMPTY;
    }

    public OptionalDouble lookup(String documentNumber) {
        if (documentNumber == null) {
            return OptionalDouble.empty();
        }
        Double probability = probabilities.get(documentNumber.trim());
        return probability == null ? OptionalDouble.empty() : OptionalDouble.of(probability);
    }

    public int size() {
        return probabilities.size();
    }
}
