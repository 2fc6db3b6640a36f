package com.missionforge.core.error;

/** The generator returned empty text or text without the expected code block. */
public class GenerationFailureException extends VerificationException {

    public GenerationFailureException(String message) {
        super(message);
    }

    public GenerationFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.GENERATION_FAILURE;
    }
}
