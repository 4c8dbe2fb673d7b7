package com.eainde.kyc.scoring;

import java.util.List;
import java.util.Map;

/**
 * Intermediate values of one scoring run, for operators checking that the loaded artifacts
 * agree with each other.
 *
 * @param features raw feature values keyed by feature name
 * @param stages   output of each step of the active tier, in order; empty when no tier is usable
 * @param outcome  what {@link ModelBundle#evaluate} returns for the same record
 * @param error    message of the failure that forced a fallback, or null
 */
public record ScoringDiagnostics(ScoringCapability capability,
                                 Map<String, Double> features,
                                 List<Stage> stages,
                                 ScoringOutcome outcome,
                                 String error) {

    public record Stage(String name, List<Double> values) {
    }
}
