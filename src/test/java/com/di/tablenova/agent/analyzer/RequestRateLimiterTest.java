package com.di.tablenova.agent.analyzer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RequestRateLimiter Tests")
class RequestRateLimiterTest {

    @Test
    @DisplayName("Should not wait on the first call")
    void testAcquire_FirstCallImmediate() {
        RequestRateLimiter limiter = new RequestRateLimiter(Duration.ofSeconds(5));

        long start = System.nanoTime();
        limiter.acquire();

        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(1));
    }

    @Test
    @DisplayName("Should space consecutive calls by the minimum interval")
    void testAcquire_SpacesCalls() {
        RequestRateLimiter limiter = new RequestRateLimiter(Duration.ofMillis(100));

        long start = System.nanoTime();
        limiter.acquire();
        limiter.acquire();
        limiter.acquire();

        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(200));
    }

    @Test
    @DisplayName("Should serialise concurrent callers")
    void testAcquire_Concurrent() throws InterruptedException {
        RequestRateLimiter limiter = new RequestRateLimiter(Duration.ofMillis(50));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);

        long start = System.nanoTime();
        for (int i = 0; i < 4; i++) {
            pool.execute(() -> {
                limiter.acquire();
                done.countDown();
            });
        }
        assertTrue(done.await(5, TimeUnit.SECONDS));
        pool.shutdown();

        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(150));
    }

    @Test
    @DisplayName("Should reject a negative interval")
    void testConstructor_Negative() {
        assertThrows(IllegalArgumentException.class, () -> new RequestRateLimiter(Duration.ofMillis(-1)));
        assertEquals(Duration.ZERO, new RequestRateLimiter(Duration.ZERO).getMinInterval());
    }
}
