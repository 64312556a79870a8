package com.di.tablenova.agent.batch;

import com.di.tablenova.agent.job.CancellationToken;
import com.di.tablenova.analysis.model.TableDescriptor;
import com.di.tablenova.support.TestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BatchAnalysisOrchestrator Tests")
class BatchAnalysisOrchestratorTest {

    private ExecutorService pool;
    private BatchAnalysisOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(8);
        orchestrator = new BatchAnalysisOrchestrator(pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static List<TableDescriptor> tables(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> TestFixtures.table("tbl" + i, "Table " + i))
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should isolate a failing table from the rest of the batch")
    void testAnalyzeBatch_FailureIsolated() {
        BatchAnalysisResult<String> result = orchestrator.analyzeBatch(tables(10), 3, 2, table -> {
            if (table.getTableId().equals("tbl5")) {
                throw new IllegalStateException("boom");
            }
            return table.getTableName();
        }, CancellationToken.none(), null);

        assertEquals(9, result.getResults().size());
        assertEquals(1, result.getFailures().size());
        TableFailure failure = result.getFailures().get(0);
        assertEquals("tbl5", failure.getTableId());
        assertEquals("Table 5", failure.getTableName());
        assertEquals("IllegalStateException: boom", failure.getError());
        assertEquals(4, result.getBatchesRun());
        assertFalse(result.isCancelled());
        assertFalse(result.getResults().containsKey("tbl5"));
    }

    @Test
    @DisplayName("Should never run more tasks at once than the concurrency limit")
    void testAnalyzeBatch_ConcurrencyLimit() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxSeen = new AtomicInteger();

        orchestrator.analyzeBatch(tables(12), 6, 2, table -> {
            int now = inFlight.incrementAndGet();
            maxSeen.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            return table.getTableId();
        }, CancellationToken.none(), null);

        assertTrue(maxSeen.get() <= 2, "max in flight " + maxSeen.get());
    }

    @Test
    @DisplayName("Should finish each batch before starting the next and report progress")
    void testAnalyzeBatch_ProgressPerBatch() {
        List<int[]> progress = new CopyOnWriteArrayList<>();

        BatchAnalysisResult<String> result = orchestrator.analyzeBatch(tables(7), 3, 3, TableDescriptor::getTableId,
                CancellationToken.none(), (done, total) -> progress.add(new int[]{done, total}));

        assertEquals(7, result.getResults().size());
        assertEquals(3, progress.size());
        assertArrayEquals(new int[]{3, 7}, progress.get(0));
        assertArrayEquals(new int[]{6, 7}, progress.get(1));
        assertArrayEquals(new int[]{7, 7}, progress.get(2));
    }

    @Test
    @DisplayName("Should stop scheduling batches once cancelled")
    void testAnalyzeBatch_Cancelled() {
        CancellationToken token = new CancellationToken();
        List<String> seen = new ArrayList<>();

        BatchAnalysisResult<String> result = orchestrator.analyzeBatch(tables(9), 3, 1, table -> {
            synchronized (seen) {
                seen.add(table.getTableId());
            }
            return table.getTableId();
        }, token, (done, total) -> token.cancel());

        assertTrue(result.isCancelled());
        assertEquals(1, result.getBatchesRun());
        assertEquals(3, result.getResults().size());
        assertEquals(3, seen.size());
    }

    @Test
    @DisplayName("Should return an empty result for no tables")
    void testAnalyzeBatch_Empty() {
        BatchAnalysisResult<String> result = orchestrator.analyzeBatch(List.of(), 3, 2, TableDescriptor::getTableId,
                null, null);

        assertTrue(result.getResults().isEmpty());
        assertEquals(0, result.getBatchesRun());
    }

    @Test
    @DisplayName("Should reject non-positive batch size and concurrency")
    void testAnalyzeBatch_InvalidArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.analyzeBatch(tables(1), 0, 1, TableDescriptor::getTableId, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.analyzeBatch(tables(1), 1, 0, TableDescriptor::getTableId, null, null));
    }
}
