package com.missionforge.core.error;

/** The temporal-logic property could not be translated into an automaton. */
public class PropertySyntaxException extends VerificationException {

    public PropertySyntaxException(String message) {
        super(message);
    }

    public PropertySyntaxException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.PROPERTY_SYNTAX;
    }
}
