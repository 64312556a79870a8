package com.di.tablenova.ai.provider;

/**
 * Failure talking to the completion provider. The message is used for error classification,
 * so it should carry the provider's own wording.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
