package com.eainde.kyc.scoring;

import com.eainde.kyc.model.FeatureVector;
import com.eainde.kyc.model.IdentityRecord;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Holds the loaded scoring artifacts and exposes a single scoring call that never fails.
 *
 * <h3>Degradation ladder</h3>
 * <p>Evaluated once in {@link #assemble}; the first rung whose artifacts are present and whose
 * widths chain wins and stays fixed for the lifetime of the bundle:</p>
 * <ol>
 *   <li>{@code FULL}: selector, then scaler, then classifier</li>
 *   <li>{@code PARTIAL}: selector only, then scaler only</li>
 *   <li>{@code CLASSIFIER_ONLY}: raw vector straight into the classifier</li>
 *   <li>{@code UNAVAILABLE}: prior evaluation for the document number, else the safe default</li>
 * </ol>
 *
 * <p>A failure inside a single scoring call is logged and answered from the
 * {@code UNAVAILABLE} rung for that call only. The bundle is immutable and shared by all
 * requests without locking.</p>
 */
@Log4j2
public final class ModelBundle {

    private final ScoringTier tier;
    private final ModelArtifacts artifacts;
    private final PriorEvaluationStore priorEvaluations;
    private final double safeDefaultProbability;

    private ModelBundle(ScoringTier tier,
                        ModelArtifacts artifacts,
                        PriorEvaluationStore priorEvaluations,
                        double safeDefaultProbability) {
        this.tier = tier;
        this.artifacts = artifacts;
        this.priorEvaluations = priorEvaluations;
        this.safeDefaultProbability = safeDefaultProbability;
    }

    public static ModelBundle assemble(ModelArtifacts artifacts,
                                       PriorEvaluationStore priorEvaluations,
                                       double safeDefaultProbability) {
        if (!(safeDefaultProbability > 0.0 && safeDefaultProbability < 1.0)) {
            throw new IllegalArgumentException(
                    "Safe default probability must lie strictly between 0 and 1: " + safeDefaultProbability);
        }

        ScoringTier selected = null;
        for (ScoringTier candidate : ladder(artifacts)) {
            String mismatch = candidate.widthMismatch(FeatureVector.WIDTH);
            if (mismatch == null) {
                selected = candidate;
                break;
            }
            log.warn("Skipping {} scoring: {}", candidate.capability(), mismatch);
        }

        ModelBundle bundle = new ModelBundle(selected, artifacts, priorEvaluations, safeDefaultProbability);
        if (selected == null) {
            log.warn("No usable classifier, scoring runs in UNAVAILABLE mode ({} prior evaluations, default {})",
                    priorEvaluations.size(), safeDefaultProbability);
        } else {
            log.info("Model bundle ready: {}", selected);
        }
        return bundle;
    }

    public static ModelBundle unavailable(PriorEvaluationStore priorEvaluations, double safeDefaultProbability) {
        return assemble(ModelArtifacts.none(), priorEvaluations, safeDefaultProbability);
    }

    private static List<ScoringTier> ladder(ModelArtifacts artifacts) {
        List<ScoringTier> tiers = new ArrayList<>();
        Classifier classifier = artifacts.classifier();
        if (classifier == null) {
            return tiers;
        }
        FeatureSelector selector = artifacts.selector();
        StandardScaler scaler = artifacts.scaler();
        if (selector != null && scaler != null) {
            tiers.add(new ScoringTier(ScoringCapability.FULL, List.of(selector, scaler), classifier));
        }
        if (selector != null) {
            tiers.add(new ScoringTier(ScoringCapability.PARTIAL, List.of(selector), classifier));
        }
        if (scaler != null) {
            tiers.add(new ScoringTier(ScoringCapability.PARTIAL, List.of(scaler), classifier));
        }
        tiers.add(new ScoringTier(ScoringCapability.CLASSIFIER_ONLY, List.of(), classifier));
        return tiers;
    }

    public ScoringCapability capability() {
        return tier == null ? ScoringCapability.UNAVAILABLE : tier.capability();
    }

    /**
     * Scores a feature vector. Without identity fields the fallback is always the safe default.
     *
     * @return fraud probability in [0, 1]
     */
    public double score(FeatureVector vector) {
        return evaluate(vector, null).probability();
    }

    /**
     * Scores a record, using its document number for the prior-evaluation fallback.
     */
    public ScoringOutcome evaluate(IdentityRecord record, FeatureVector vector) {
        return evaluate(vector, record.documentNumber());
    }

    private ScoringOutcome evaluate(FeatureVector vector, String documentNumber) {
        if (tier != null) {
            try {
                double probability = tier.score(vector.toArray());
                if (Double.isFinite(probability)) {
                    return new ScoringOutcome(clamp(probability), ScoringSource.MODEL);
                }
                log.error("{} scoring produced non-finite probability {}, falling back", tier.capability(), probability);
            } catch (RuntimeException e) {
                log.error("{} scoring failed, falling back", tier.capability(), e);
            }
        }
        return fallback(documentNumber);
    }

    /**
     * Runs the active tier step by step. Unlike {@link #evaluate} a failing step is reported
     * in the result rather than only logged.
     */
    public ScoringDiagnostics diagnose(IdentityRecord record, FeatureVector vector) {
        Map<String, Double> features = new LinkedHashMap<>();
        for (int i = 0; i < vector.width(); i++) {
            features.put(FeatureVector.FEATURE_NAMES.get(i), vector.get(i));
        }
        if (tier == null) {
            return new ScoringDiagnostics(capability(), features, List.of(),
                    fallback(record.documentNumber()), null);
        }
        try {
            List<ScoringDiagnostics.Stage> stages = tier.trace(vector.toArray());
            return new ScoringDiagnostics(capability(), features, stages, evaluate(record, vector), null);
        } catch (RuntimeException e) {
            log.warn("{} diagnostic run failed: {}", tier.capability(), e.getMessage());
            return new ScoringDiagnostics(capability(), features, List.of(),
                    fallback(record.documentNumber()), e.getMessage());
        }
    }

    private ScoringOutcome fallback(String documentNumber) {
        OptionalDouble prior = priorEvaluations.lookup(documentNumber);
        if (prior.isPresent()) {
            log.debug("Using prior evaluation for document {}", documentNumber);
            return new ScoringOutcome(clamp(prior.getAsDouble()), ScoringSource.PRIOR_EVALUATION);
        }
        log.debug("No prior evaluation, using safe default {}", safeDefaultProbability);
        return new ScoringOutcome(safeDefaultProbability, ScoringSource.SAFE_DEFAULT);
    }

    public BundleStatus status() {
        return new BundleStatus(
                capability(),
                artifacts.classifier() != null,
                artifacts.selector() != null,
                artifacts.scaler() != null,
                priorEvaluations.size()
        );
    }

    private static double clamp(double probability) {
        return Math.max(0.0, Math.min(1.0, probability));
    }
}
