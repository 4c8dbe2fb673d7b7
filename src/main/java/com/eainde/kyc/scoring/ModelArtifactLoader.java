package com.eainde.kyc.scoring;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads exported scoring artifacts. Every artifact is optional: a blank location, a missing
 * file or an unreadable document is logged and reported as absent, never thrown.
 */
@Log4j2
@Component
public class ModelArtifactLoader {

    static final String PRIOR_DOCUMENT_COLUMN = "Document_Number";
    static final String PRIOR_PROBABILITY_COLUMN = "GNN_Fraud_Probability";

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;

    public ModelArtifactLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper, CsvMapper csvMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.csvMapper = csvMapper;
    }

    public ModelArtifacts loadArtifacts(String classifierLocation, String selectorLocation, String scalerLocation) {
        return ModelArtifacts.builder()
                .classifier(load(classifierLocation, Classifier.class, "classifier").orElse(null))
                .selector(load(selectorLocation, FeatureSelector.class, "feature selector").orElse(null))
                .scaler(load(scalerLocation, StandardScaler.class, "scaler").orElse(null))
                .build();
    }

    public <T> Optional<T> load(String location, Class<T> type, String label) {
        Optional<Resource> resource = resolve(location, label);
        if (resource.isEmpty()) {
            return Optional.empty();
        }
        try (InputStream in = resource.get().getInputStream()) {
            T artifact = objectMapper.readValue(in, type);
            log.info("Loaded {} from {}: {}", label, location, artifact);
            return Optional.of(artifact);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load {} from {}, continuing without it", label, location, e);
            return Optional.empty();
        }
    }

    /**
     * Reads prior evaluations from a CSV with {@code Document_Number} and
     * {@code GNN_Fraud_Probability} columns. Rows with a blank number or an unparsable
     * probability are skipped; the first row wins for repeated document numbers.
     */
    public PriorEvaluationStore loadPriorEvaluations(String location) {
        Optional<Resource> resource = resolve(location, "prior evaluations");
        if (resource.isEmpty()) {
            return PriorEvaluationStore.empty();
        }
        Map<String, Double> probabilities = new LinkedHashMap<>();
        int skipped = 0;
        try (InputStream in = resource.get().getInputStream();
             MappingIterator<Map<String, String>> rows = csvMapper
                     .readerForMapOf(String.class)
                     .with(CsvSchema.emptySchema().withHeader())
                     .readValues(in)) {
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                String documentNumber = row.get(PRIOR_DOCUMENT_COLUMN);
                Double probability = parseProbability(row.get(PRIOR_PROBABILITY_COLUMN));
                if (documentNumber == null || documentNumber.isBlank() || probability == null) {
                    skipped++;
                    continue;
                }
                probabilities.putIfAbsent(documentNumber.trim(), probability);
            }
        } catch (IOException | RuntimeException e) {
            log.error("Failed to read prior evaluations from {}, continuing without them", location, e);
            return PriorEvaluationStore.empty();
        }
        if (skipped > 0) {
            log.warn("Skipped {} unusable prior-evaluation rows in {}", skipped, location);
        }
        log.info("Loaded {} prior evaluations from {}", probabilities.size(), location);
        return new PriorEvaluationStore(probabilities);
    }

    private Optional<Resource> resolve(String location, String label) {
        if (location == null || location.isBlank()) {
            log.warn("No location configured for {}", label);
            return Optional.empty();
        }
        Resource resource = resourceLoader.getResource(location.trim());
        if (!resource.exists()) {
            log.warn("{} not found at {}", label, location);
            return Optional.empty();
        }
        return Optional.of(resource);
    }

    private static Double parseProbability(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            double probability = Double.parseDouble(value.trim());
            return Double.isFinite(probability) ? probability : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
