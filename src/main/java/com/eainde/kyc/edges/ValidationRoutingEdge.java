package com.eainde.kyc.edges;

import com.eainde.kyc.state.PipelineStage;
import com.eainde.kyc.state.VerificationState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Rejected records leave the graph before any scoring.
 */
@Component
public class ValidationRoutingEdge implements AsyncEdgeAction<VerificationState> {

    public static final String ACCEPTED = "accepted";
    public static final String REJECTED = "rejected";

    @Override
    public CompletableFuture<String> apply(VerificationState state) {
        return CompletableFuture.completedFuture(
                state.getStage() == PipelineStage.REJECTED ? REJECTED : ACCEPTED);
    }
}
