package com.example.placescout_backend;

/**
 * Transport-level failure talking to the language model.
 */
public class LanguageModelException extends RuntimeException {

    private final boolean retryable;

    public LanguageModelException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public LanguageModelException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * Timeouts, 5xx answers, transport errors and empty bodies are worth another attempt.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
