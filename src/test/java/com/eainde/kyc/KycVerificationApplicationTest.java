package com.eainde.kyc;

import com.eainde.kyc.scoring.ModelBundle;
import com.eainde.kyc.scoring.ScoringCapability;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class KycVerificationApplicationTest {

    @TempDir
    static Path auditDir;

    @DynamicPropertySource
    static void auditProperties(DynamicPropertyRegistry registry) {
        registry.add("kyc.audit.path", () -> auditDir.resolve("kyc_audit_log.csv").toString());
        registry.add("kyc.audit.fsync", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ModelBundle modelBundle;

    @Test
    void verifiesAndListsHistoryWithPackagedModels() throws Exception {
        assertThat(modelBundle.capability()).isEqualTo(ScoringCapability.FULL);

        mockMvc.perform(post("/api/verify-kyc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"John Doe\",\"documentNumber\":\"123456789012\","
                                + "\"address\":\"123 Main Street, City, State 12345\",\"documentType\":\"AADHAR\"}"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.name").value("John Doe"))
                .andExpect(jsonPath("$.degraded").value(false));

        mockMvc.perform(get("/api/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].documentNumber").value("123456789012"));

        mockMvc.perform(get("/"))
                .andExpect(jsonPath("$.scoringCapability").value("FULL"))
                .andExpect(jsonPath("$.priorEvaluations").value(4));
    }
}
