package com.missionforge.core.schema;

/**
 * Result of validating a mission document; errorText is null when valid.
 */
public class ValidationResult {

    private final boolean valid;
    private final String  errorText;

    private ValidationResult(boolean valid, String errorText) {
        this.valid     = valid;
        this.errorText = errorText;
    }

    public static ValidationResult valid() {
        return new ValidationResult(true, null);
    }

    public static ValidationResult invalid(String errorText) {
        return new ValidationResult(false, errorText);
    }

    public boolean isValid()      { return valid; }
    public String getErrorText()  { return errorText; }

    @Override
    public String toString() {
        return valid ? "ValidationResult{valid}" : "ValidationResult{invalid: " + errorText + "}";
    }
}
