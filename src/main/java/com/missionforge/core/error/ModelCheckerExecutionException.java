package com.missionforge.core.error;

/**
 * SPIN exited nonzero. This is a tool or syntax problem, not a property
 * violation; the message holds the tool output verbatim.
 */
public class ModelCheckerExecutionException extends VerificationException {

    public ModelCheckerExecutionException(String message) {
        super(message);
    }

    public ModelCheckerExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.MODEL_CHECKER_EXECUTION;
    }
}
