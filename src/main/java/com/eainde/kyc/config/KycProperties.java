package com.eainde.kyc.config;

import com.eainde.kyc.model.DocumentType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Settings bound from the {@code kyc.*} namespace of application.yml.
 *
 * <pre>
 * kyc:
 *   model:
 *     classifier-path: classpath:models/classifier.json
 *     selector-path: classpath:models/feature-selector.json
 *     scaler-path: classpath:models/scaler.json
 *     prior-evaluations-path: classpath:models/prior-evaluations.csv
 *     safe-default-probability: 0.50
 *   audit:
 *     path: data/kyc_audit_log.csv
 *     fsync: true
 *   batch:
 *     parallelism: 4
 *     max-rows: 10000
 *   features:
 *     document-patterns:
 *       AADHAR: "\\d{12}"
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "kyc")
public class KycProperties {

    private Model model = new Model();
    private Audit audit = new Audit();
    private Batch batch = new Batch();
    private Features features = new Features();

    @Getter
    @Setter
    public static class Model {
        /** Spring resource locations; a blank or missing location means the artifact is absent. */
        private String classifierPath;
        private String selectorPath;
        private String scalerPath;
        private String priorEvaluationsPath;
        private double safeDefaultProbability = 0.50;
    }

    @Getter
    @Setter
    public static class Audit {
        private String path = "data/kyc_audit_log.csv";
        private boolean fsync = true;
    }

    @Getter
    @Setter
    public static class Batch {
        private int parallelism = 4;
        private int maxRows = 10_000;
    }

    @Getter
    @Setter
    public static class Features {
        /** Regex overrides for document-number well-formedness, keyed by document type. */
        private Map<DocumentType, String> documentPatterns = new EnumMap<>(DocumentType.class);
    }
}
