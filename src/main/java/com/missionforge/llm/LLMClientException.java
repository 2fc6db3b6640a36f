package com.missionforge.llm;

/**
 * The model backend could not produce an answer (transport error, malformed response).
 */
public class LLMClientException extends RuntimeException {

    public LLMClientException(String message) {
        super(message);
    }

    public LLMClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
