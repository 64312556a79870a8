package com.di.tablenova.ai.provider;

import com.di.tablenova.ai.config.AiProperties;
import com.di.tablenova.config.AsyncConfig;
import com.di.tablenova.metrics.AnalysisMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * {@link CompletionProvider} backed by a Spring AI {@link ChatClient} (Vertex AI Gemini).
 *
 * <p>The blocking call runs on the bounded provider executor. After {@code tablenova.ai.call-timeout}
 * its task is cancelled, which interrupts the worker thread, and the caller gets a
 * {@link ProviderTimeoutException}. A full executor fails the call at once instead of queueing it.
 */
@Slf4j
@Component
public class SpringAiCompletionProvider implements CompletionProvider {

    private final ChatClient chatClient;
    private final AsyncTaskExecutor executor;
    private final Duration timeout;
    private final ModelPricing pricing;
    private final AnalysisMetrics metrics;

    public SpringAiCompletionProvider(ChatClient chatClient,
                                      @Qualifier(AsyncConfig.PROVIDER_EXECUTOR) AsyncTaskExecutor executor,
                                      AiProperties aiProperties,
                                      AnalysisMetrics metrics) {
        this.chatClient = chatClient;
        this.executor = executor;
        this.timeout = aiProperties.getCallTimeout();
        this.pricing = ModelPricing.from(aiProperties.getPricing());
        this.metrics = metrics;
    }

    @Override
    public CompletionResult complete(CompletionRequest request) {
        long start = System.nanoTime();
        Future<ChatResponse> future;
        try {
            future = executor.submit(() -> call(request));
        } catch (RejectedExecutionException e) {
            metrics.recordProviderError(Duration.ofNanos(System.nanoTime() - start));
            throw new ProviderException("Provider pool exhausted, no resource free for another call", e);
        }
        try {
            ChatResponse response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            CompletionResult result = toResult(response, request.getModel());
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordProviderCall(latency, result.getCost());
            log.debug("[PROVIDER] model={} tokens in={} out={} cost={} latency={}ms", result.getModel(),
                    result.getUsage().getInputTokens(), result.getUsage().getOutputTokens(), result.getCost(),
                    latency.toMillis());
            return result;
        } catch (TimeoutException e) {
            // Interrupts the worker so a hung call does not keep its thread.
            future.cancel(true);
            metrics.recordProviderError(Duration.ofNanos(System.nanoTime() - start));
            throw new ProviderTimeoutException(timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException("Provider call interrupted", e);
        } catch (ExecutionException e) {
            metrics.recordProviderError(Duration.ofNanos(System.nanoTime() - start));
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ProviderException) {
                throw (ProviderException) cause;
            }
            throw new ProviderException(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        }
    }

    private ChatResponse call(CompletionRequest request) {
        List<Message> messages = request.getMessages().stream()
                .map(SpringAiCompletionProvider::toMessage)
                .collect(Collectors.toList());
        ChatOptions options = ChatOptions.builder()
                .model(request.getModel())
                .temperature(request.getTemperature())
                .maxTokens(request.getMaxTokens())
                .build();
        ChatResponse response = chatClient.prompt()
                .messages(messages)
                .options(options)
                .call()
                .chatResponse();
        if (response == null || response.getResult() == null) {
            throw new ProviderException("Provider returned no generation");
        }
        return response;
    }

    private CompletionResult toResult(ChatResponse response, String requestedModel) {
        Generation generation = response.getResult();
        AssistantMessage output = generation.getOutput();
        TokenUsage usage = TokenUsage.NONE;
        if (response.getMetadata() != null && response.getMetadata().getUsage() != null) {
            Usage u = response.getMetadata().getUsage();
            usage = new TokenUsage(
                    u.getPromptTokens() != null ? u.getPromptTokens() : 0,
                    u.getCompletionTokens() != null ? u.getCompletionTokens() : 0);
        }
        String model = response.getMetadata() != null && response.getMetadata().getModel() != null
                && !response.getMetadata().getModel().isBlank()
                ? response.getMetadata().getModel() : requestedModel;
        return CompletionResult.builder()
                .text(output != null && output.getText() != null ? output.getText() : "")
                .usage(usage)
                .cost(pricing.cost(usage))
                .model(model)
                .finishReason(generation.getMetadata() != null ? generation.getMetadata().getFinishReason() : null)
                .build();
    }

    private static Message toMessage(PromptMessage message) {
        switch (message.getRole()) {
            case SYSTEM:
                return new SystemMessage(message.getContent());
            case ASSISTANT:
                return new AssistantMessage(message.getContent());
            default:
                return new UserMessage(message.getContent());
        }
    }
}
