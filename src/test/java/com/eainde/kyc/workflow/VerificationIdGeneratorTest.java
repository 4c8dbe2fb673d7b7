package com.eainde.kyc.workflow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class VerificationIdGeneratorTest {

    private final VerificationIdGenerator generator = new VerificationIdGenerator();

    @Test
    @DisplayName("ids within the same millisecond are distinct and increasing")
    void sameMillisecond() {
        Instant now = Instant.parse("2025-03-01T12:00:00Z");
        Set<String> ids = new HashSet<>();
        long previous = 0;
        for (int i = 0; i < 500; i++) {
            String id = generator.nextId(now);
            long value = Long.parseLong(id.substring(3));
            assertThat(id).startsWith("VER");
            assertThat(value).isGreaterThan(previous);
            previous = value;
            ids.add(id);
        }
        assertThat(ids).hasSize(500);
    }

    @Test
    @DisplayName("a clock going backwards never repeats an id")
    void clockRegression() {
        String later = generator.nextId(Instant.parse("2025-03-01T12:00:01Z"));
        String earlier = generator.nextId(Instant.parse("2025-03-01T12:00:00Z"));

        assertThat(Long.parseLong(earlier.substring(3))).isGreaterThan(Long.parseLong(later.substring(3)));
    }
}
