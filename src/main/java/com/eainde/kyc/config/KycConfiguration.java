package com.eainde.kyc.config;

import com.eainde.kyc.audit.AuditLog;
import com.eainde.kyc.audit.CsvAuditLog;
import com.eainde.kyc.scoring.ModelArtifactLoader;
import com.eainde.kyc.scoring.ModelArtifacts;
import com.eainde.kyc.scoring.ModelBundle;
import com.eainde.kyc.scoring.PriorEvaluationStore;
import com.eainde.kyc.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.nio.file.Path;
import java.time.Clock;

@Log4j2
@Configuration
@EnableConfigurationProperties(KycProperties.class)
public class KycConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * JSON mapper for the web layer and artifact loading. Declared explicitly because the
     * {@link CsvMapper} bean below is also an {@link ObjectMapper}.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder.createXmlMapper(false).build();
    }

    @Bean
    public CsvMapper csvMapper() {
        return new CsvMapper();
    }

    @Bean(name = "batchExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor batchExecutor(KycProperties properties) {
        int parallelism = properties.getBatch().getParallelism();
        log.info("Batch executor running {} workers", parallelism);
        return new MdcAwareExecutor(parallelism, "kyc-batch");
    }

    /**
     * Loaded once at startup. Missing or broken artifacts degrade the bundle rather than
     * failing the context.
     */
    @Bean
    public ModelBundle modelBundle(ModelArtifactLoader loader, KycProperties properties) {
        KycProperties.Model model = properties.getModel();
        ModelArtifacts artifacts = loader.loadArtifacts(
                model.getClassifierPath(),
                model.getSelectorPath(),
                model.getScalerPath());
        PriorEvaluationStore priors = loader.loadPriorEvaluations(model.getPriorEvaluationsPath());
        return ModelBundle.assemble(artifacts, priors, model.getSafeDefaultProbability());
    }

    @Bean
    public AuditLog auditLog(KycProperties properties, CsvMapper csvMapper, Clock clock) {
        KycProperties.Audit audit = properties.getAudit();
        CsvAuditLog auditLog = new CsvAuditLog(Path.of(audit.getPath()), audit.isFsync(), csvMapper, clock.getZone());
        log.info("Audit log at {} (fsync={})", auditLog.getPath().toAbsolutePath(), audit.isFsync());
        return auditLog;
    }
}
