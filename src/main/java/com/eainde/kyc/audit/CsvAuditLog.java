package com.eainde.kyc.audit;

import com.eainde.kyc.exception.AuditPersistenceException;
import com.eainde.kyc.model.RiskLevel;
import com.eainde.kyc.risk.RiskClassifier;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.log4j.Log4j2;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Audit log kept as a CSV file, one entry per line.
 *
 * <h3>Columns</h3>
 * <pre>
 * Timestamp,Name,Document_Number,ID_Type,Fraud_Probability,Fraud_Risk_Level,Confidence
 * </pre>
 *
 * <h3>Writing</h3>
 * <ul>
 *   <li>Appends are serialised by a lock and each entry goes out in one channel write.</li>
 *   <li>The header is written when the file is new or empty.</li>
 *   <li>An existing file keeps its own column order, legacy {@code Fraud_Risk} included.</li>
 *   <li>Line breaks inside fields are replaced by spaces so an entry never spans lines.</li>
 *   <li>A torn final line from an earlier crash is closed off before the next entry.</li>
 * </ul>
 *
 * <h3>Reading</h3>
 * <ul>
 *   <li>Columns are mapped by the header, so column order does not matter.</li>
 *   <li>Older logs are accepted: a {@code Fraud_Risk} column, missing confidence and local timestamps.</li>
 *   <li>Lines that cannot be parsed are skipped with a warning.</li>
 * </ul>
 */
@Log4j2
public class CsvAuditLog implements AuditLog {

    public static final String TIMESTAMP = "Timestamp";
    public static final String NAME = "Name";
    public static final String DOCUMENT_NUMBER = "Document_Number";
    public static final String ID_TYPE = "ID_Type";
    public static final String FRAUD_PROBABILITY = "Fraud_Probability";
    public static final String FRAUD_RISK_LEVEL = "Fraud_Risk_Level";
    public static final String CONFIDENCE = "Confidence";

    static final String LEGACY_FRAUD_RISK = "Fraud_Risk";
    static final List<String> COLUMNS = List.of(
            TIMESTAMP, NAME, DOCUMENT_NUMBER, ID_TYPE, FRAUD_PROBABILITY, FRAUD_RISK_LEVEL, CONFIDENCE);

    private final Path path;
    private final boolean fsync;
    private final ZoneId legacyZone;
    private final CsvMapper csvMapper;
    private final ReentrantLock writeLock = new ReentrantLock();

    public CsvAuditLog(Path path, boolean fsync, CsvMapper csvMapper, ZoneId legacyZone) {
        this.path = path;
        this.fsync = fsync;
        this.csvMapper = csvMapper;
        this.legacyZone = legacyZone;
    }

    public Path getPath() {
        return path;
    }

    // =========================================================================
    //  Append
    // =========================================================================

    @Override
    public void append(AuditEntry entry) {
        writeLock.lock();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            boolean fresh = Files.notExists(path) || Files.size(path) == 0;
            StringBuilder text = new StringBuilder();
            if (!fresh && !endsWithLineBreak()) {
                log.warn("Audit log {} ends with a partial entry, starting a new line", path);
                text.append('\n');
            }
            List<String> columns = fresh ? COLUMNS : existingColumns();
            CsvSchema schema = schemaOf(columns);
            text.append(csvMapper.writer(fresh ? schema.withHeader() : schema.withoutHeader())
                    .writeValueAsString(rowValues(entry, columns)));
            write(text.toString().getBytes(StandardCharsets.UTF_8));
            log.debug("Appended audit entry for document {}", entry.documentNumber());
        } catch (IOException e) {
            throw new AuditPersistenceException("Failed to append audit entry to " + path, e);
        } finally {
            writeLock.unlock();
        }
    }

    private void write(byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            if (fsync) {
                channel.force(false);
            }
        }
    }

    private List<String> existingColumns() throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    List<String> header = parseHeader(line);
                    return header.contains(TIMESTAMP) ? header : COLUMNS;
                }
            }
        }
        return COLUMNS;
    }

    private static Map<String, String> rowValues(AuditEntry entry, List<String> columns) {
        Map<String, String> known = Map.of(
                TIMESTAMP, entry.timestamp().toString(),
                NAME, singleLine(entry.name()),
                DOCUMENT_NUMBER, singleLine(entry.documentNumber()),
                ID_TYPE, singleLine(entry.idType()),
                FRAUD_PROBABILITY, entry.fraudProbability().setScale(2, RoundingMode.HALF_UP).toPlainString(),
                FRAUD_RISK_LEVEL, entry.riskLevel().label(),
                LEGACY_FRAUD_RISK, entry.riskLevel().label(),
                CONFIDENCE, entry.confidence().setScale(2, RoundingMode.HALF_UP).toPlainString());
        Map<String, String> values = new LinkedHashMap<>();
        for (String column : columns) {
            values.put(column, known.getOrDefault(column, ""));
        }
        return values;
    }

    private static String singleLine(String value) {
        return value == null ? "" : value.replaceAll("[\\r\\n]+", " ");
    }

    private static CsvSchema schemaOf(List<String> columns) {
        return CsvSchema.builder().addColumns(columns, CsvSchema.ColumnType.STRING).build();
    }

    private boolean endsWithLineBreak() throws IOException {
        try (SeekableByteChannel channel = Files.newByteChannel(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0) {
                return true;
            }
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(size - 1);
            channel.read(last);
            return last.get(0) == '\n';
        }
    }

    // =========================================================================
    //  Read
    // =========================================================================

    @Override
    public List<AuditEntry> readAll() {
        if (Files.notExists(path)) {
            return List.of();
        }
        String content;
        try {
            content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AuditPersistenceException("Failed to read audit log " + path, e);
        }

        List<String> lines = Arrays.stream(content.split("\\R"))
                .filter(line -> !line.isBlank())
                .toList();
        if (lines.isEmpty()) {
            return List.of();
        }

        List<String> header = parseHeader(lines.get(0));
        int firstDataLine = 1;
        if (!header.contains(TIMESTAMP)) {
            log.warn("Audit log {} has no header, assuming default column order", path);
            header = COLUMNS;
            firstDataLine = 0;
        }

        ObjectReader rowReader = csvMapper.readerForMapOf(String.class).with(schemaOf(header));

        List<AuditEntry> entries = new ArrayList<>(lines.size());
        int skipped = 0;
        for (int i = firstDataLine; i < lines.size(); i++) {
            try {
                Map<String, String> row = rowReader.readValue(lines.get(i));
                entries.add(toEntry(row));
            } catch (IOException | RuntimeException e) {
                skipped++;
                log.warn("Skipping unreadable audit line {} in {}: {}", i + 1, path, e.getMessage());
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} unreadable line(s) in audit log {}", skipped, path);
        }

        entries.sort(Comparator.comparing(AuditEntry::timestamp).reversed());
        return entries;
    }

    private List<String> parseHeader(String line) {
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(line.replace("\uFEFF", ""))) {
            if (!it.hasNextValue()) {
                return List.of();
            }
            return Arrays.stream(it.nextValue()).map(String::trim).toList();
        } catch (IOException | RuntimeException e) {
            log.warn("Unreadable header in audit log {}: {}", path, e.getMessage());
            return List.of();
        }
    }

    private AuditEntry toEntry(Map<String, String> row) {
        Instant timestamp = parseTimestamp(required(row, TIMESTAMP));
        BigDecimal probability = new BigDecimal(required(row, FRAUD_PROBABILITY).trim())
                .setScale(2, RoundingMode.HALF_UP);
        if (probability.signum() < 0 || probability.compareTo(new BigDecimal("100")) > 0) {
            throw new IllegalArgumentException("Fraud probability out of range: " + probability);
        }

        String levelText = row.getOrDefault(FRAUD_RISK_LEVEL, row.get(LEGACY_FRAUD_RISK));
        RiskLevel level = levelText == null || levelText.isBlank()
                ? RiskClassifier.levelFor(probability)
                : RiskLevel.fromLabel(levelText)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown risk level: " + levelText));

        String confidenceText = row.get(CONFIDENCE);
        BigDecimal confidence = confidenceText == null || confidenceText.isBlank()
                ? RiskClassifier.confidenceFor(probability)
                : new BigDecimal(confidenceText.trim()).setScale(2, RoundingMode.HALF_UP);

        return new AuditEntry(
                timestamp,
                required(row, NAME),
                required(row, DOCUMENT_NUMBER),
                row.getOrDefault(ID_TYPE, ""),
                probability,
                level,
                confidence
        );
    }

    private Instant parseTimestamp(String text) {
        String trimmed = text.trim();
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(trimmed.replace(' ', 'T')).atZone(legacyZone).toInstant();
        }
    }

    private static String required(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing " + column);
        }
        return value;
    }
}
