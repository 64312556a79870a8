package com.di.tablenova.resilience;

/**
 * A provider response arrived but could not be used in full (e.g. truncated at the token limit).
 * The raw text is kept so the {@code partial} fallback can try to salvage it.
 */
public class PartialResponseException extends RuntimeException {

    private final String partialText;

    public PartialResponseException(String message, String partialText) {
        super(message);
        this.partialText = partialText;
    }

    public String getPartialText() {
        return partialText;
    }
}
