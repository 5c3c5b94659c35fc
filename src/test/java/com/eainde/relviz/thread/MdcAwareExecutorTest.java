package com.eainde.relviz.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MdcAwareExecutorTest {

    private final MdcAwareExecutor executor = new MdcAwareExecutor("test-mdc-");

    @AfterEach
    void tearDown() {
        MDC.clear();
        executor.close();
    }

    @Test
    @DisplayName("should run tasks with the submitter's MDC and clear it afterwards")
    void carriesMdc() throws Exception {
        MDC.put("renderId", "abc123");

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("renderId"), executor).get(5, TimeUnit.SECONDS);
        MDC.clear();
        String leftOver = CompletableFuture.supplyAsync(() -> MDC.get("renderId"), executor).get(5, TimeUnit.SECONDS);

        assertThat(seen).isEqualTo("abc123");
        assertThat(leftOver).isNull();
    }

    @Test
    @DisplayName("should run tasks on named daemon threads")
    void daemonThreads() throws Exception {
        Thread thread = CompletableFuture.supplyAsync(Thread::currentThread, executor).get(5, TimeUnit.SECONDS);

        assertThat(thread.isDaemon()).isTrue();
        assertThat(thread.getName()).startsWith("test-mdc-");
    }
}
