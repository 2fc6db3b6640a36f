package com.missionforge.core.schema;

import com.missionforge.core.error.ToolConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import javax.xml.validation.Validator;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * XSD validation through javax.xml.validation. Compiled schemas are cached
 * per path; a {@link Validator} is created per call since it is not thread-safe.
 */
@Component
public class XsdSchemaValidator implements SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(XsdSchemaValidator.class);

    private final Map<Path, Schema> compiled = new ConcurrentHashMap<>();

    @Override
    public ValidationResult validate(Path schemaRef, String documentText) throws ToolConfigurationException {
        Schema schema = load(schemaRef.toAbsolutePath().normalize());

        Validator validator = schema.newValidator();
        try {
            validator.validate(new StreamSource(new StringReader(documentText)));
            log.info("[SchemaValidator] Mission is valid against {}", schemaRef.getFileName());
            return ValidationResult.valid();
        } catch (SAXParseException e) {
            String error = String.format("XML is invalid (line %d, column %d): %s",
                    e.getLineNumber(), e.getColumnNumber(), e.getMessage());
            log.debug("[SchemaValidator] {}", error);
            return ValidationResult.invalid(error);
        } catch (SAXException | IOException e) {
            log.debug("[SchemaValidator] Validation error: {}", e.getMessage());
            return ValidationResult.invalid("XML is invalid: " + e.getMessage());
        }
    }

    private Schema load(Path schemaPath) throws ToolConfigurationException {
        Schema schema = compiled.get(schemaPath);
        if (schema != null) return schema;

        if (!Files.isRegularFile(schemaPath)) {
            throw new ToolConfigurationException("Schema file not found: " + schemaPath);
        }
        try {
            SchemaFactory factory = SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI);
            schema = factory.newSchema(schemaPath.toFile());
        } catch (SAXException e) {
            throw new ToolConfigurationException("Schema " + schemaPath + " cannot be compiled: " + e.getMessage(), e);
        }

        compiled.put(schemaPath, schema);
        log.info("[SchemaValidator] Loaded schema {}", schemaPath);
        return schema;
    }
}
