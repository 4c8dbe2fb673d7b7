package com.eainde.kyc.scoring;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One rung of the degradation ladder: an ordered chain of transforms ending in the classifier.
 */
record ScoringTier(ScoringCapability capability, List<FeatureTransform> transforms, Classifier classifier) {

    ScoringTier {
        transforms = List.copyOf(transforms);
    }

    /**
     * @return null when the widths chain from {@code rawWidth} through every transform into the
     * classifier, otherwise a description of the first mismatch
     */
    String widthMismatch(int rawWidth) {
        int width = rawWidth;
        for (FeatureTransform transform : transforms) {
            if (transform.inputWidth() != width) {
                return transform + " expects " + transform.inputWidth() + " features but receives " + width;
            }
            width = transform.outputWidth();
        }
        if (classifier.inputWidth() != width) {
            return classifier + " expects " + classifier.inputWidth() + " features but receives " + width;
        }
        return null;
    }

    double score(double[] features) {
        double[] current = features;
        for (FeatureTransform transform : transforms) {
            current = transform.transform(current);
        }
        return classifier.predictProbability(current);
    }

    /**
     * Same chain as {@link #score}, keeping the output of every transform and the classifier.
     */
    List<ScoringDiagnostics.Stage> trace(double[] features) {
        List<ScoringDiagnostics.Stage> stages = new ArrayList<>(transforms.size() + 1);
        double[] current = features;
        for (FeatureTransform transform : transforms) {
            current = transform.transform(current);
            stages.add(new ScoringDiagnostics.Stage(transform.stageName(), boxed(current)));
        }
        stages.add(new ScoringDiagnostics.Stage("classifier", List.of(classifier.predictProbability(current))));
        return stages;
    }

    private static List<Double> boxed(double[] values) {
        return Arrays.stream(values).boxed().toList();
    }

    @Override
    public String toString() {
        return capability + transforms.toString() + " -> " + classifier;
    }
}
