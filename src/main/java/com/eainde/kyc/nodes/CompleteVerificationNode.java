package com.eainde.kyc.nodes;

import com.eainde.kyc.scoring.ScoringOutcome;
import com.eainde.kyc.state.PipelineStage;
import com.eainde.kyc.state.VerificationState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class CompleteVerificationNode implements AsyncNodeAction<VerificationState> {

    @Override
    public CompletableFuture<Map<String, Object>> apply(VerificationState state) {
        boolean degraded = state.getScoring().map(ScoringOutcome::degraded).orElse(true);
        PipelineStage stage = degraded ? PipelineStage.DEGRADED_COMPLETED : PipelineStage.COMPLETED;
        return CompletableFuture.completedFuture(Map.of(VerificationState.STAGE, stage));
    }
}
