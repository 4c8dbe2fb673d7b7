package com.eainde.kyc.workflow;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues {@code VER}-prefixed ids that are unique within the process and increase with time,
 * even when many records are scored in the same millisecond.
 */
@Component
public class VerificationIdGenerator {

    private static final int SEQUENCE_SLOTS = 1000;

    private final AtomicLong last = new AtomicLong();

    public String nextId(Instant timestamp) {
        long candidate = timestamp.toEpochMilli() * SEQUENCE_SLOTS;
        long next = last.updateAndGet(previous -> Math.max(previous + 1, candidate));
        return "VER" + next;
    }
}
