package com.eainde.kyc.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MdcAwareExecutorTest {

    private final MdcAwareExecutor executor = new MdcAwareExecutor(1, "mdc-test");

    @AfterEach
    void tearDown() throws InterruptedException {
        MDC.clear();
        executor.shutdown();
    }

    @Test
    @DisplayName("copies the caller's MDC into the worker and clears it afterwards")
    void propagatesMdc() throws Exception {
        MDC.put("requestId", "req-1");

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("requestId"), executor).get(5, TimeUnit.SECONDS);
        MDC.clear();
        String leftOver = CompletableFuture.supplyAsync(() -> MDC.get("requestId"), executor).get(5, TimeUnit.SECONDS);

        assertThat(seen).isEqualTo("req-1");
        assertThat(leftOver).isNull();
    }

    @Test
    @DisplayName("workers are named after the prefix")
    void namesThreads() throws Exception {
        String name = CompletableFuture.supplyAsync(() -> Thread.currentThread().getName(), executor)
                .get(5, TimeUnit.SECONDS);

        assertThat(name).startsWith("mdc-test-");
    }

    @Test
    void rejectsZeroParallelism() {
        assertThatThrownBy(() -> new MdcAwareExecutor(0, "x")).isInstanceOf(IllegalArgumentException.class);
    }
}
