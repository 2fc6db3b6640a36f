package com.missionforge.core.error;

/** The mission document does not validate against its schema. */
public class SchemaViolationException extends VerificationException {

    public SchemaViolationException(String message) {
        super(message);
    }

    public SchemaViolationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.SCHEMA_VIOLATION;
    }
}
