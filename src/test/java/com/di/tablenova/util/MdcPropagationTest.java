package com.di.tablenova.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcPropagation Tests")
class MdcPropagationTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should carry the caller's MDC into a task run on another thread")
    void testWrapRunnable_OtherThread() throws Exception {
        MDC.put("jobId", "batch-1");
        AtomicReference<String> seen = new AtomicReference<>();
        Runnable task = MdcPropagation.wrapRunnable(() -> seen.set(MDC.get("jobId")));
        MDC.remove("jobId");

        Thread worker = new Thread(task);
        worker.start();
        worker.join();

        assertEquals("batch-1", seen.get());
    }

    @Test
    @DisplayName("Should remove the keys it set once the task ends")
    void testRunWithMdcContext_ClearsKeys() {
        AtomicReference<String> seen = new AtomicReference<>();

        MdcPropagation.runWithMdcContext(Map.of("requestId", "req-7"), () -> seen.set(MDC.get("requestId")));

        assertEquals("req-7", seen.get());
        assertNull(MDC.get("requestId"));
        assertTrue(MdcPropagation.copyMdc().isEmpty());
    }
}
