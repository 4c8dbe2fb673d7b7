package com.eainde.kyc.nodes;

import com.eainde.kyc.audit.AuditEntry;
import com.eainde.kyc.audit.AuditLog;
import com.eainde.kyc.exception.AuditPersistenceException;
import com.eainde.kyc.model.VerificationResult;
import com.eainde.kyc.state.PipelineStage;
import com.eainde.kyc.state.VerificationState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Writes exactly one audit entry per classified record. A write failure ends the run in
 * {@link PipelineStage#PERSISTENCE_FAILED}.
 */
@Log4j2
@Component
public class AppendAuditNode implements AsyncNodeAction<VerificationState> {

    private final AuditLog auditLog;

    public AppendAuditNode(AuditLog auditLog) {
        this.auditLog = auditLog;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(VerificationState state) {
        VerificationResult result = state.getResult()
                .orElseThrow(() -> new IllegalStateException("Audit reached without a result"));
        try {
            auditLog.append(AuditEntry.from(result));
        } catch (AuditPersistenceException e) {
            log.error("Audit write failed for {}", result.id(), e);
            return CompletableFuture.completedFuture(
                    VerificationState.failed(PipelineStage.PERSISTENCE_FAILED, List.of(e.getMessage())));
        }
        return CompletableFuture.completedFuture(Map.of(VerificationState.STAGE, PipelineStage.LOGGED));
    }
}
