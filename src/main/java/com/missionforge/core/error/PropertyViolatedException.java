package com.missionforge.core.error;

/** The model checker produced a counterexample trail; the message is the replayed trail. */
public class PropertyViolatedException extends VerificationException {

    public PropertyViolatedException(String message) {
        super(message);
    }

    public PropertyViolatedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.PROPERTY_VIOLATED;
    }
}
