package com.di.tablenova.ai.provider;

import com.di.tablenova.ai.config.AiProperties;
import com.di.tablenova.metrics.AnalysisMetrics;
import com.di.tablenova.resilience.ErrorCategory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SpringAiCompletionProvider Tests")
class SpringAiCompletionProviderTest {

    private ThreadPoolTaskExecutor pool;
    private CountDownLatch release;
    private AtomicInteger invocations;
    private AtomicBoolean hungCallInterrupted;

    @BeforeEach
    void setUp() {
        pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(1);
        pool.setMaxPoolSize(1);
        pool.setQueueCapacity(1);
        pool.setThreadNamePrefix("provider-test-");
        pool.initialize();
        release = new CountDownLatch(1);
        invocations = new AtomicInteger();
        hungCallInterrupted = new AtomicBoolean();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        pool.shutdown();
    }

    private SpringAiCompletionProvider provider(ChatModel model, Duration timeout) {
        AiProperties properties = new AiProperties();
        properties.setCallTimeout(timeout);
        return new SpringAiCompletionProvider(ChatClient.builder(model).build(), pool, properties,
                new AnalysisMetrics(new SimpleMeterRegistry()));
    }

    private static CompletionRequest request() {
        return CompletionRequest.builder()
                .message(PromptMessage.system("You are a table analysis assistant."))
                .message(PromptMessage.user("Analyse the Customers table"))
                .model("gemini-2.0-flash-001")
                .temperature(0.1)
                .maxTokens(100)
                .build();
    }

    private static ChatResponse answer(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    /** The first call blocks until released or interrupted; later calls answer at once. */
    private ChatModel firstCallHangs() {
        return prompt -> {
            if (invocations.incrementAndGet() == 1) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    hungCallInterrupted.set(true);
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("call interrupted", e);
                }
            }
            return answer("[]");
        };
    }

    // =========================================================================
    // Calls
    // =========================================================================

    @Test
    @DisplayName("Should return the generated text with the requested model")
    void testComplete_Success() {
        CompletionResult result = provider(prompt -> answer("[{\"priority\":\"high\"}]"), Duration.ofSeconds(5))
                .complete(request());

        assertEquals("[{\"priority\":\"high\"}]", result.getText());
        assertEquals("gemini-2.0-flash-001", result.getModel());
        assertNotNull(result.getUsage());
    }

    @Test
    @DisplayName("Should wrap a model failure in a ProviderException carrying its message")
    void testComplete_ModelFailure() {
        ProviderException e = assertThrows(ProviderException.class,
                () -> provider(prompt -> {
                    throw new IllegalStateException("403 Forbidden");
                }, Duration.ofSeconds(5)).complete(request()));

        assertTrue(e.getMessage().contains("403 Forbidden"), e.getMessage());
        assertEquals(ErrorCategory.AUTHENTICATION, ErrorCategory.categorize(e));
    }

    // =========================================================================
    // Timeout
    // =========================================================================

    @Test
    @DisplayName("Should interrupt a hung call on timeout and free its thread for the next call")
    void testComplete_TimeoutFreesThread() {
        SpringAiCompletionProvider provider = provider(firstCallHangs(), Duration.ofMillis(300));

        ProviderTimeoutException timeout = assertThrows(ProviderTimeoutException.class, () -> provider.complete(request()));
        assertEquals(ErrorCategory.TIMEOUT, ErrorCategory.categorize(timeout));

        CompletionResult next = provider.complete(request());

        assertEquals("[]", next.getText());
        assertEquals(2, invocations.get());
        assertTrue(hungCallInterrupted.get());
    }

    @Test
    @DisplayName("Should fail at once when the provider pool is full")
    void testComplete_PoolFull() {
        // One running and one queued task fill the single-thread pool.
        for (int i = 0; i < 2; i++) {
            pool.execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        SpringAiCompletionProvider provider = provider(prompt -> answer("[]"), Duration.ofSeconds(5));

        ProviderException e = assertThrows(ProviderException.class, () -> provider.complete(request()));

        assertFalse(e instanceof ProviderTimeoutException);
        assertEquals(ErrorCategory.RESOURCE, ErrorCategory.categorize(e));
        assertEquals(0, invocations.get());
    }
}
