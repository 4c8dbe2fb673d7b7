package com.eainde.kyc.controller;

import com.eainde.kyc.feature.FeatureExtractor;
import com.eainde.kyc.model.IdentityRecord;
import com.eainde.kyc.model.VerificationRequest;
import com.eainde.kyc.scoring.ModelBundle;
import com.eainde.kyc.scoring.ScoringDiagnostics;
import com.eainde.kyc.validation.IdentityRecordValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator view of the scoring chain. Nothing here is written to the audit log.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ScoringDiagnosticsController {

    static final List<VerificationRequest> SAMPLES = List.of(
            new VerificationRequest("John Doe", "ABCDE1234F", "123 Main St", "PAN"),
            new VerificationRequest("Jane Smith", "987654321012", "456 Oak Ave", "AADHAR"));

    private final IdentityRecordValidator validator;
    private final FeatureExtractor featureExtractor;
    private final ModelBundle modelBundle;

    @GetMapping("/api/admin/test-prediction")
    public Map<String, Object> samples() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", modelBundle.status());
        body.put("results", SAMPLES.stream().map(this::diagnose).toList());
        return body;
    }

    @PostMapping(value = "/api/admin/test-prediction", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ScoringDiagnostics testPrediction(@RequestBody VerificationRequest request) {
        return diagnose(request);
    }

    private ScoringDiagnostics diagnose(VerificationRequest request) {
        IdentityRecord record = validator.validate(request);
        ScoringDiagnostics diagnostics = modelBundle.diagnose(record, featureExtractor.extract(record));
        log.info("Diagnostic run for document {}: {} via {}", record.documentNumber(),
                diagnostics.outcome().probability(), diagnostics.outcome().source());
        return diagnostics;
    }
}
