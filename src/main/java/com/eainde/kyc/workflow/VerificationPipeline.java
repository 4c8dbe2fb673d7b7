package com.eainde.kyc.workflow;

import com.eainde.kyc.exception.AuditPersistenceException;
import com.eainde.kyc.exception.KycException;
import com.eainde.kyc.exception.RecordValidationException;
import com.eainde.kyc.model.VerificationRequest;
import com.eainde.kyc.model.VerificationResult;
import com.eainde.kyc.state.PipelineStage;
import com.eainde.kyc.state.VerificationState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for verifying one identity submission.
 *
 * <p>Runs the {@code verificationWorkflow} graph synchronously and turns its terminal stage
 * into a result or an exception:</p>
 * <ul>
 *   <li>{@code COMPLETED} / {@code DEGRADED_COMPLETED}: the result, already in the audit log</li>
 *   <li>{@code REJECTED}: {@link RecordValidationException}, nothing scored or logged</li>
 *   <li>{@code PERSISTENCE_FAILED}: {@link AuditPersistenceException}, the result is discarded</li>
 * </ul>
 * Safe for concurrent use; every call runs on its own graph thread id.
 */
@Log4j2
@Service
public class VerificationPipeline {

    static final String REQUEST_ID_MDC_KEY = "requestId";

    private final CompiledGraph<VerificationState> workflow;

    public VerificationPipeline(@Qualifier("verificationWorkflow") CompiledGraph<VerificationState> workflow) {
        this.workflow = workflow;
    }

    public VerificationResult verify(VerificationRequest request) {
        if (request == null) {
            throw new RecordValidationException(List.of("request is required"));
        }
        String requestId = UUID.randomUUID().toString();
        String previousRequestId = MDC.get(REQUEST_ID_MDC_KEY);
        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        try {
            VerificationState finalState = run(request, requestId);
            return outcome(finalState);
        } finally {
            if (previousRequestId == null) {
                MDC.remove(REQUEST_ID_MDC_KEY);
            } else {
                MDC.put(REQUEST_ID_MDC_KEY, previousRequestId);
            }
        }
    }

    private VerificationState run(VerificationRequest request, String requestId) {
        RunnableConfig config = RunnableConfig.builder()
                .threadId(requestId)
                .build();
        try {
            return workflow.invoke(VerificationState.initial(request), config)
                    .orElseThrow(() -> new KycException("Verification workflow produced no state"));
        } catch (KycException e) {
            throw e;
        } catch (Exception e) {
            throw new KycException("Verification workflow failed", e);
        }
    }

    private VerificationResult outcome(VerificationState state) {
        PipelineStage stage = state.getStage();
        log.debug("Verification finished in stage {}", stage);
        if (!stage.isTerminal()) {
            throw new KycException("Verification workflow stopped in non-terminal stage " + stage);
        }
        switch (stage) {
            case COMPLETED:
            case DEGRADED_COMPLETED:
                VerificationResult result = state.getResult()
                        .orElseThrow(() -> new KycException("Workflow completed without a result"));
                log.info("Verified {} as {} ({}%){}", result.id(), result.riskLevel().label(),
                        result.fraudProbability(), stage == PipelineStage.DEGRADED_COMPLETED ? " [degraded]" : "");
                return result;
            case REJECTED:
                throw new RecordValidationException(state.getErrors());
            case PERSISTENCE_FAILED:
                throw new AuditPersistenceException(String.join("; ", state.getErrors()));
            default:
                throw new IllegalStateException("Unhandled terminal stage " + stage);
        }
    }
}
