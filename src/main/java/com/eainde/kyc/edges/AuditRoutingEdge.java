package com.eainde.kyc.edges;

import com.eainde.kyc.state.PipelineStage;
import com.eainde.kyc.state.VerificationState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
public class AuditRoutingEdge implements AsyncEdgeAction<VerificationState> {

    public static final String LOGGED = "logged";
    public static final String FAILED = "failed";

    @Override
    public CompletableFuture<String> apply(VerificationState state) {
        return CompletableFuture.completedFuture(
                state.getStage() == PipelineStage.PERSISTENCE_FAILED ? FAILED : LOGGED);
    }
}
