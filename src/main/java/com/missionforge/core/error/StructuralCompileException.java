package com.missionforge.core.error;

/**
 * The mission uses a behavior-tree shape the compiler does not support.
 * Regenerating will not help, so the session aborts.
 */
public class StructuralCompileException extends VerificationException {

    public StructuralCompileException(String message) {
        super(message);
    }

    public StructuralCompileException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.STRUCTURAL_COMPILE_ERROR;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
