package com.eainde.kyc.scoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ModelArtifactLoaderTest {

    private ModelArtifactLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ModelArtifactLoader(new DefaultResourceLoader(), new ObjectMapper(), new CsvMapper());
    }

    @Nested
    @DisplayName("loadArtifacts()")
    class LoadArtifacts {

        @Test
        @DisplayName("reads classifier, selector and scaler into a FULL bundle")
        void readsAll() {
            ModelArtifacts artifacts = loader.loadArtifacts(
                    "classpath:models/classifier-width6.json",
                    "classpath:models/selector.json",
                    "classpath:models/scaler-width6.json");

            assertThat(artifacts.classifier()).isInstanceOf(LogisticRegressionClassifier.class);
            assertThat(artifacts.classifier().inputWidth()).isEqualTo(6);
            assertThat(artifacts.selector().inputWidth()).isEqualTo(8);
            assertThat(artifacts.selector().outputWidth()).isEqualTo(6);
            assertThat(artifacts.scaler().inputWidth()).isEqualTo(6);
            assertThat(ModelBundle.assemble(artifacts, PriorEvaluationStore.empty(), 0.5).capability())
                    .isEqualTo(ScoringCapability.FULL);
        }

        @Test
        @DisplayName("missing, blank and corrupt locations load as absent")
        void absentArtifacts() {
            ModelArtifacts artifacts = loader.loadArtifacts(
                    "classpath:models/broken.json",
                    "classpath:models/does-not-exist.json",
                    " ");

            assertThat(artifacts.classifier()).isNull();
            assertThat(artifacts.selector()).isNull();
            assertThat(artifacts.scaler()).isNull();
        }

        @Test
        @DisplayName("an artifact of the wrong shape is absent rather than an error")
        void wrongShape() {
            Optional<StandardScaler> scaler = loader.load("classpath:models/selector.json", StandardScaler.class, "scaler");

            assertThat(scaler).isEmpty();
        }
    }

    @Nested
    @DisplayName("loadPriorEvaluations()")
    class LoadPriorEvaluations {

        @Test
        @DisplayName("keeps the first row per document and skips unusable rows")
        void readsPriors() {
            PriorEvaluationStore store = loader.loadPriorEvaluations("classpath:models/prior-evaluations-fixture.csv");

            assertThat(store.size()).isEqualTo(2);
            assertThat(store.lookup("123456789012")).hasValue(0.12);
            assertThat(store.lookup(" ABCDE1234F ")).hasValue(0.81);
            assertThat(store.lookup("BADROW00001")).isEmpty();
        }

        @Test
        @DisplayName("a missing file gives an empty store")
        void missingFile() {
            assertThat(loader.loadPriorEvaluations("classpath:models/none.csv").size()).isZero();
            assertThat(loader.loadPriorEvaluations(null).size()).isZero();
        }
    }
}
