package com.missionforge.core.error;

/** The arbiter judged the sampled runs unfaithful to the mission request. */
public class ArbiterRejectionException extends VerificationException {

    public ArbiterRejectionException(String message) {
        super(message);
    }

    public ArbiterRejectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.ARBITER_REJECTION;
    }
}
