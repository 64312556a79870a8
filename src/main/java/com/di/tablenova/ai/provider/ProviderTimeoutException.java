package com.di.tablenova.ai.provider;

import java.time.Duration;

/** The call exceeded its timeout; message always contains "timeout". */
public class ProviderTimeoutException extends ProviderException {

    public ProviderTimeoutException(Duration timeout, Throwable cause) {
        super("Provider call timeout after " + timeout.toMillis() + " ms", cause);
    }
}
