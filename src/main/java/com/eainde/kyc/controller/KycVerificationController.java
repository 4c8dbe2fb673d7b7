package com.eainde.kyc.controller;

import com.eainde.kyc.audit.VerificationHistory;
import com.eainde.kyc.batch.BatchSummary;
import com.eainde.kyc.batch.BatchVerificationService;
import com.eainde.kyc.exception.MalformedBatchException;
import com.eainde.kyc.model.VerificationRequest;
import com.eainde.kyc.model.VerificationResult;
import com.eainde.kyc.scoring.BundleStatus;
import com.eainde.kyc.scoring.ModelBundle;
import com.eainde.kyc.workflow.VerificationPipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class KycVerificationController {

    private final VerificationPipeline pipeline;
    private final BatchVerificationService batchService;
    private final VerificationHistory history;
    private final ModelBundle modelBundle;

    @GetMapping("/")
    public Map<String, Object> status() {
        BundleStatus bundle = modelBundle.status();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "KYC risk verification");
        body.put("status", "running");
        body.put("scoringCapability", bundle.capability());
        body.put("classifierLoaded", bundle.classifierLoaded());
        body.put("selectorLoaded", bundle.selectorLoaded());
        body.put("scalerLoaded", bundle.scalerLoaded());
        body.put("priorEvaluations", bundle.priorEvaluations());
        return body;
    }

    @PostMapping(value = "/api/verify-kyc", consumes = MediaType.APPLICATION_JSON_VALUE)
    public VerificationResult verify(@RequestBody VerificationRequest request) {
        return pipeline.verify(request);
    }

    @PostMapping(value = "/api/verify-kyc-batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public BatchSummary verifyBatch(@RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            throw new MalformedBatchException("Uploaded batch file is empty");
        }
        try (InputStream in = file.getInputStream()) {
            return batchService.process(in);
        } catch (IOException e) {
            throw new MalformedBatchException("Uploaded batch file could not be read", e);
        }
    }

    @GetMapping("/api/history")
    public List<VerificationResult> history(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        return history.recent(limit);
    }
}
