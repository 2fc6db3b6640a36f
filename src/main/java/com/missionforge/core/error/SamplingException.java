package com.missionforge.core.error;

/** No accepting run could be drawn from the translated automaton. */
public class SamplingException extends VerificationException {

    public SamplingException(String message) {
        super(message);
    }

    public SamplingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.SAMPLING_FAILURE;
    }
}
