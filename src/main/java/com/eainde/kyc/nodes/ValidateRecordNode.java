package com.eainde.kyc.nodes;

import com.eainde.kyc.exception.RecordValidationException;
import com.eainde.kyc.model.IdentityRecord;
import com.eainde.kyc.state.PipelineStage;
import com.eainde.kyc.state.VerificationState;
import com.eainde.kyc.validation.IdentityRecordValidator;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Received -> Received (accepted) or Rejected.
 */
@Log4j2
@Component
public class ValidateRecordNode implements AsyncNodeAction<VerificationState> {

    private final IdentityRecordValidator validator;

    public ValidateRecordNode(IdentityRecordValidator validator) {
        this.validator = validator;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(VerificationState state) {
        try {
            IdentityRecord identity = validator.validate(state.getRequest().orElse(null));
            return CompletableFuture.completedFuture(Map.of(VerificationState.IDENTITY, identity));
        } catch (RecordValidationException e) {
            log.info("Rejected submission: {}", e.getViolations());
            return CompletableFuture.completedFuture(
                    VerificationState.failed(PipelineStage.REJECTED, e.getViolations()));
        }
    }
}
