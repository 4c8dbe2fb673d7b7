package com.eainde.kyc.state;

import com.eainde.kyc.model.FeatureVector;
import com.eainde.kyc.model.IdentityRecord;
import com.eainde.kyc.model.VerificationRequest;
import com.eainde.kyc.model.VerificationResult;
import com.eainde.kyc.scoring.ScoringOutcome;
import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public class VerificationState extends AgentState {

    public static final String REQUEST = "request";
    public static final String IDENTITY = "identity";
    public static final String FEATURES = "features";
    public static final String SCORING = "scoring";
    public static final String RESULT = "result";
    public static final String STAGE = "stage";
    public static final String ERRORS = "errors";

    public VerificationState(Map<String, Object> initData) {
        super(initData);
    }

    public Optional<VerificationRequest> getRequest() {
        return Optional.ofNullable((VerificationRequest) data().get(REQUEST));
    }

    public Optional<IdentityRecord> getIdentity() {
        return Optional.ofNullable((IdentityRecord) data().get(IDENTITY));
    }

    public Optional<FeatureVector> getFeatures() {
        return Optional.ofNullable((FeatureVector) data().get(FEATURES));
    }

    public Optional<ScoringOutcome> getScoring() {
        return Optional.ofNullable((ScoringOutcome) data().get(SCORING));
    }

    public Optional<VerificationResult> getResult() {
        return Optional.ofNullable((VerificationResult) data().get(RESULT));
    }

    public PipelineStage getStage() {
        Object stage = data().get(STAGE);
        return stage == null ? PipelineStage.RECEIVED : (PipelineStage) stage;
    }

    @SuppressWarnings("unchecked")
    public List<String> getErrors() {
        Object errors = data().get(ERRORS);
        return errors == null ? List.of() : (List<String>) errors;
    }

    public static Map<String, Object> initial(VerificationRequest request) {
        return Map.of(REQUEST, request, STAGE, PipelineStage.RECEIVED);
    }

    public static Map<String, Object> failed(PipelineStage stage, List<String> errors) {
        return Map.of(STAGE, stage, ERRORS, List.copyOf(errors));
    }
}
