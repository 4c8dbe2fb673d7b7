package com.eainde.kyc.batch;

import com.eainde.kyc.config.KycProperties;
import com.eainde.kyc.exception.MalformedBatchException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchCsvParserTest {

    private BatchCsvParser parser;

    @BeforeEach
    void setUp() {
        KycProperties properties = new KycProperties();
        properties.getBatch().setMaxRows(3);
        parser = new BatchCsvParser(new CsvMapper(), properties);
    }

    private static InputStream csv(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("headers")
    class Headers {

        @Test
        @DisplayName("accepts the display header names")
        void displayHeaders() {
            List<BatchRow> rows = parser.parse(csv(
                    "Full Name,Document Number,Address,Document Type\n"
                            + "John Doe,123456789012,\"221B Baker Street, London\",AADHAR\n"));

            assertThat(rows).containsExactly(
                    new BatchRow(1, "John Doe", "123456789012", "221B Baker Street, London", "AADHAR"));
        }

        @Test
        @DisplayName("accepts audit-style aliases in any order, with a BOM and without address")
        void aliases() {
            List<BatchRow> rows = parser.parse(csv(
                    "\uFEFFID_Type,Document_Number,Name\n"
                            + "PAN,ABCDE1234F,Priya Sharma\n"));

            assertThat(rows).singleElement().satisfies(row -> {
                assertThat(row.name()).isEqualTo("Priya Sharma");
                assertThat(row.documentNumber()).isEqualTo("ABCDE1234F");
                assertThat(row.documentType()).isEqualTo("PAN");
                assertThat(row.address()).isEmpty();
            });
        }

        @Test
        @DisplayName("a missing required column rejects the whole file")
        void missingColumn() {
            assertThatThrownBy(() -> parser.parse(csv("Name,Address\nJohn,Somewhere\n")))
                    .isInstanceOf(MalformedBatchException.class)
                    .hasMessageContaining("DOCUMENT_NUMBER")
                    .hasMessageContaining("DOCUMENT_TYPE");
        }
    }

    @Nested
    @DisplayName("rows")
    class Rows {

        @Test
        @DisplayName("short rows yield empty fields and row indices stay 1-based")
        void shortRows() {
            List<BatchRow> rows = parser.parse(csv(
                    "Name,Document Number,Address,Document Type\n"
                            + "John Doe,123456789012,Street 1,AADHAR\n"
                            + "Jane Roe\n"));

            assertThat(rows).hasSize(2);
            assertThat(rows.get(1)).isEqualTo(new BatchRow(2, "Jane Roe", "", "", ""));
        }

        @Test
        @DisplayName("blank lines are ignored")
        void blankLines() {
            List<BatchRow> rows = parser.parse(csv(
                    "Name,Document Number,Document Type\n\n"
                            + "John Doe,123456789012,AADHAR\n\n"));

            assertThat(rows).extracting(BatchRow::rowIndex).containsExactly(1);
        }

        @Test
        @DisplayName("an empty file, a header-only file and an oversized file are rejected")
        void rejectedFiles() {
            assertThatThrownBy(() -> parser.parse(csv("")))
                    .isInstanceOf(MalformedBatchException.class);
            assertThatThrownBy(() -> parser.parse(csv("Name,Document Number,Document Type\n")))
                    .isInstanceOf(MalformedBatchException.class)
                    .hasMessageContaining("no data rows");
            assertThatThrownBy(() -> parser.parse(csv("Name,Document Number,Document Type\n"
                    + "A,1,PAN\nB,2,PAN\nC,3,PAN\nD,4,PAN\n")))
                    .isInstanceOf(MalformedBatchException.class)
                    .hasMessageContaining("limit of 3");
        }
    }

    @Test
    @DisplayName("reads the sample upload fixture")
    void readsFixture() throws Exception {
        BatchCsvParser defaults = new BatchCsvParser(new CsvMapper(), new KycProperties());
        try (InputStream in = getClass().getResourceAsStream("/batch/mixed.csv")) {
            List<BatchRow> rows = defaults.parse(in);

            assertThat(rows).hasSize(4);
            assertThat(rows.get(2).name()).isEmpty();
            assertThat(rows.get(2).rowIndex()).isEqualTo(3);
        }
    }
}
