package com.example.interview.service;

/**
 * The model provider could not be reached within the retry budget, or rejected the call permanently.
 */
public class LlmUnavailableException extends RuntimeException {

    public LlmUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
