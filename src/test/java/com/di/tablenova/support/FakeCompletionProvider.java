package com.di.tablenova.support;

import com.di.tablenova.ai.provider.CompletionProvider;
import com.di.tablenova.ai.provider.CompletionRequest;
import com.di.tablenova.ai.provider.CompletionResult;
import com.di.tablenova.ai.provider.PromptMessage;
import com.di.tablenova.ai.provider.TokenUsage;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Completion provider answering from a function of the user prompt. Requests are recorded.
 */
public class FakeCompletionProvider implements CompletionProvider {

    public static final double COST_PER_CALL = 0.001;

    private final Function<String, String> responder;
    private final List<CompletionRequest> requests = new CopyOnWriteArrayList<>();
    private volatile String finishReason = "STOP";

    public FakeCompletionProvider(Function<String, String> responder) {
        this.responder = responder;
    }

    /** Answers every prompt with one well-formed finding. */
    public static FakeCompletionProvider alwaysOneFinding() {
        return new FakeCompletionProvider(prompt ->
                TestFixtures.providerResponse("The Email field of this table lacks validation", 0.9));
    }

    public FakeCompletionProvider finishingWith(String reason) {
        this.finishReason = reason;
        return this;
    }

    @Override
    public CompletionResult complete(CompletionRequest request) {
        requests.add(request);
        String userPrompt = request.getMessages().stream()
                .filter(m -> m.getRole() == PromptMessage.Role.USER)
                .map(PromptMessage::getContent)
                .findFirst()
                .orElse("");
        return CompletionResult.builder()
                .text(responder.apply(userPrompt))
                .usage(new TokenUsage(100, 50))
                .cost(COST_PER_CALL)
                .model(request.getModel())
                .finishReason(finishReason)
                .build();
    }

    public List<CompletionRequest> getRequests() {
        return requests;
    }

    public int callCount() {
        return requests.size();
    }
}
