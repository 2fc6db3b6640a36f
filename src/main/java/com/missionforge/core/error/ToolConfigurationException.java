package com.missionforge.core.error;

/** An external binary or configured path is missing or unusable. */
public class ToolConfigurationException extends VerificationException {

    public ToolConfigurationException(String message) {
        super(message);
    }

    public ToolConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.TOOL_CONFIGURATION;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
