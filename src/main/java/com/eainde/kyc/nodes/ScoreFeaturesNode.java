package com.eainde.kyc.nodes;

import com.eainde.kyc.model.FeatureVector;
import com.eainde.kyc.model.IdentityRecord;
import com.eainde.kyc.scoring.ModelBundle;
import com.eainde.kyc.scoring.ScoringOutcome;
import com.eainde.kyc.state.PipelineStage;
import com.eainde.kyc.state.VerificationState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Scores through the shared {@link ModelBundle}. Never fails: degradation is recorded in the
 * outcome, not raised.
 */
@Log4j2
@Component
public class ScoreFeaturesNode implements AsyncNodeAction<VerificationState> {

    private final ModelBundle modelBundle;

    public ScoreFeaturesNode(ModelBundle modelBundle) {
        this.modelBundle = modelBundle;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(VerificationState state) {
        IdentityRecord identity = state.getIdentity().orElseThrow();
        FeatureVector features = state.getFeatures()
                .orElseThrow(() -> new IllegalStateException("Scoring reached without features"));

        ScoringOutcome outcome = modelBundle.evaluate(identity, features);
        if (outcome.degraded()) {
            log.warn("Degraded scoring ({}) for document {}", outcome.source(), identity.documentNumber());
        }
        return CompletableFuture.completedFuture(Map.of(
                VerificationState.SCORING, outcome,
                VerificationState.STAGE, PipelineStage.SCORED
        ));
    }
}
