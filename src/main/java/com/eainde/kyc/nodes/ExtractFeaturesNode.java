package com.eainde.kyc.nodes;

import com.eainde.kyc.feature.FeatureExtractor;
import com.eainde.kyc.model.FeatureVector;
import com.eainde.kyc.model.IdentityRecord;
import com.eainde.kyc.state.PipelineStage;
import com.eainde.kyc.state.VerificationState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Log4j2
@Component
public class ExtractFeaturesNode implements AsyncNodeAction<VerificationState> {

    private final FeatureExtractor featureExtractor;

    public ExtractFeaturesNode(FeatureExtractor featureExtractor) {
        this.featureExtractor = featureExtractor;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(VerificationState state) {
        IdentityRecord identity = state.getIdentity()
                .orElseThrow(() -> new IllegalStateException("Feature extraction reached without a validated record"));
        FeatureVector features = featureExtractor.extract(identity);
        log.debug("Extracted {}", features);
        return CompletableFuture.completedFuture(Map.of(
                VerificationState.FEATURES, features,
                VerificationState.STAGE, PipelineStage.FEATURES_EXTRACTED
        ));
    }
}
