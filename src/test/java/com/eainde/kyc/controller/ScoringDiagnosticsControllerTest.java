package com.eainde.kyc.controller;

import com.eainde.kyc.feature.DocumentNumberRules;
import com.eainde.kyc.feature.FeatureExtractor;
import com.eainde.kyc.model.FeatureVector;
import com.eainde.kyc.scoring.FeatureSelector;
import com.eainde.kyc.scoring.LogisticRegressionClassifier;
import com.eainde.kyc.scoring.ModelArtifacts;
import com.eainde.kyc.scoring.ModelBundle;
import com.eainde.kyc.scoring.PriorEvaluationStore;
import com.eainde.kyc.scoring.StandardScaler;
import com.eainde.kyc.validation.IdentityRecordValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Arrays;
import java.util.Map;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ScoringDiagnosticsControllerTest {

    private static final String JOHN_DOE_JSON = "{\"name\":\"John Doe\",\"documentNumber\":\"123456789012\","
            + "\"address\":\"123 Main Street\",\"documentType\":\"AADHAR\"}";

    private static MockMvc mockMvc(ModelBundle bundle) {
        ScoringDiagnosticsController controller = new ScoringDiagnosticsController(
                new IdentityRecordValidator(), new FeatureExtractor(new DocumentNumberRules(Map.of())), bundle);
        return MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static ModelBundle fullBundle() {
        double[] ones = new double[6];
        Arrays.fill(ones, 1.0);
        return ModelBundle.assemble(new ModelArtifacts(
                        new LogisticRegressionClassifier(new double[6], 0.0),
                        new FeatureSelector(FeatureVector.WIDTH, new int[]{1, 5, 2, 3, 6, 7}),
                        new StandardScaler(new double[6], ones)),
                PriorEvaluationStore.empty(), 0.5);
    }

    @Test
    @DisplayName("POST shows raw features, every stage and the model probability")
    void stagesForSubmittedRecord() throws Exception {
        mockMvc(fullBundle()).perform(post("/api/admin/test-prediction")
                        .contentType(MediaType.APPLICATION_JSON).content(JOHN_DOE_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.capability").value("FULL"))
                .andExpect(jsonPath("$.features.document_number_length").value(12.0))
                .andExpect(jsonPath("$.stages[*].name").value(contains("selector", "scaler", "classifier")))
                .andExpect(jsonPath("$.stages[0].values", hasSize(6)))
                .andExpect(jsonPath("$.stages[2].values[0]").value(0.5))
                .andExpect(jsonPath("$.outcome.source").value("MODEL"));
    }

    @Test
    @DisplayName("GET runs the built-in samples against an unavailable bundle")
    void samplesWithoutModel() throws Exception {
        mockMvc(ModelBundle.unavailable(PriorEvaluationStore.empty(), 0.5))
                .perform(get("/api/admin/test-prediction"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status.capability").value("UNAVAILABLE"))
                .andExpect(jsonPath("$.results", hasSize(2)))
                .andExpect(jsonPath("$.results[0].stages", hasSize(0)))
                .andExpect(jsonPath("$.results[0].outcome.source").value("SAFE_DEFAULT"));
    }

    @Test
    @DisplayName("an invalid record is rejected like a verification request")
    void invalidRecord() throws Exception {
        mockMvc(fullBundle()).perform(post("/api/admin/test-prediction")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"documentNumber\":\"1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }
}
