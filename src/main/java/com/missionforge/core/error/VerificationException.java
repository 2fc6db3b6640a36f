package com.missionforge.core.error;

/**
 * Base of every failure raised inside the verification pipeline.
 *
 * The message is the diagnostic text: it is fed back verbatim into the next
 * generation request for recoverable kinds, and reported to the caller as the
 * final diagnostic once the retry budget is spent.
 */
public abstract class VerificationException extends Exception {

    protected VerificationException(String message) {
        super(message);
    }

    protected VerificationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind getKind();

    /** Recoverable failures are retried against the shared budget; the rest abort the session. */
    public boolean isRetryable() {
        return true;
    }
}
