package com.eainde.kyc.nodes;

import com.eainde.kyc.model.IdentityRecord;
import com.eainde.kyc.model.RiskScore;
import com.eainde.kyc.model.VerificationResult;
import com.eainde.kyc.risk.RiskClassifier;
import com.eainde.kyc.scoring.ScoringOutcome;
import com.eainde.kyc.state.PipelineStage;
import com.eainde.kyc.state.VerificationState;
import com.eainde.kyc.workflow.VerificationIdGenerator;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Derives the risk tier and builds the immutable {@link VerificationResult}.
 */
@Component
public class ClassifyRiskNode implements AsyncNodeAction<VerificationState> {

    private final RiskClassifier riskClassifier;
    private final VerificationIdGenerator idGenerator;
    private final Clock clock;

    public ClassifyRiskNode(RiskClassifier riskClassifier, VerificationIdGenerator idGenerator, Clock clock) {
        this.riskClassifier = riskClassifier;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(VerificationState state) {
        IdentityRecord identity = state.getIdentity().orElseThrow();
        ScoringOutcome outcome = state.getScoring()
                .orElseThrow(() -> new IllegalStateException("Classification reached without a score"));

        RiskScore score = riskClassifier.classify(outcome.probability());
        Instant timestamp = clock.instant();
        VerificationResult result = VerificationResult.of(
                idGenerator.nextId(timestamp),
                timestamp,
                identity,
                score,
                riskClassifier.details(score, identity),
                outcome.degraded()
        );
        return CompletableFuture.completedFuture(Map.of(
                VerificationState.RESULT, result,
                VerificationState.STAGE, PipelineStage.CLASSIFIED
        ));
    }
}
