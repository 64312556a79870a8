package com.di.tablenova.ai.provider;

/**
 * Narrow seam to the language-model provider. Implementations enforce their own call timeout
 * and report token usage and cost.
 */
public interface CompletionProvider {

    /**
     * @throws ProviderTimeoutException if the call exceeded the configured timeout
     * @throws ProviderException        for any other provider failure
     */
    CompletionResult complete(CompletionRequest request);
}
