package com.missionforge.core.error;

/**
 * FailureKind: every way a verification round can fail.
 *
 * The orchestrator routes on this value: which stage is re-entered and which
 * generation role receives the diagnostic.
 */
public enum FailureKind {
    GENERATION_FAILURE,
    SCHEMA_VIOLATION,
    STRUCTURAL_COMPILE_ERROR,
    PROPERTY_SYNTAX,
    DRIFT,
    MODEL_CHECKER_EXECUTION,
    SAMPLING_FAILURE,
    ARBITER_REJECTION,
    PROPERTY_VIOLATED,
    TOOL_CONFIGURATION
}
