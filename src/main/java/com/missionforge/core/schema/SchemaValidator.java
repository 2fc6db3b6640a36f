package com.missionforge.core.schema;

import com.missionforge.core.error.ToolConfigurationException;

import java.nio.file.Path;

public interface SchemaValidator {

    /**
     * Validate {@code documentText} against the schema at {@code schemaRef}.
     * Document problems come back as an invalid result; an unreadable schema
     * is a configuration error.
     */
    ValidationResult validate(Path schemaRef, String documentText) throws ToolConfigurationException;
}
