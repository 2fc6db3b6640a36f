package com.missionforge.core.schema;

import com.missionforge.core.error.SchemaViolationException;
import com.missionforge.core.error.ToolConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SchemaCatalog: the robot schemas a mission may target, and selection of
 * the one a generated mission declares.
 *
 * A mission names its schema in the root's {@code xsi:schemaLocation}
 * ("namespace location" pair); the location is matched against the
 * configured schemas by file name. With a single configured schema that
 * schema is used whatever the mission declares.
 */
@Component
public class SchemaCatalog {

    private static final Logger log = LoggerFactory.getLogger(SchemaCatalog.class);

    private static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";

    private final List<Path> schemas;

    public SchemaCatalog(@Value("${mission.schema.paths:}") List<String> schemaPaths) {
        this.schemas = schemaPaths.stream()
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .map(p -> Path.of(p).toAbsolutePath().normalize())
                .collect(Collectors.toUnmodifiableList());

        log.info("[SchemaCatalog] {} schema(s) configured: {}", schemas.size(), getSchemaNames());
    }

    public List<Path> getSchemas() {
        return schemas;
    }

    public List<String> getSchemaNames() {
        return schemas.stream()
                .map(p -> p.getFileName().toString())
                .collect(Collectors.toList());
    }

    /**
     * Pick the schema the mission declares.
     *
     * @throws SchemaViolationException when the mission declares none, or one that is not configured,
     *                                  and more than one schema is available
     */
    public Path select(String missionXml) throws SchemaViolationException, ToolConfigurationException {
        if (schemas.isEmpty()) {
            throw new ToolConfigurationException("No mission schema configured (mission.schema.paths)");
        }

        String location = declaredLocation(missionXml);

        if (location != null) {
            String fileName = Path.of(location).getFileName().toString();
            for (Path schema : schemas) {
                if (schema.getFileName().toString().equals(fileName)) {
                    log.debug("[SchemaCatalog] Mission selected schema {}", schema);
                    return schema;
                }
            }
        }

        if (schemas.size() == 1) {
            if (location != null) {
                log.warn("[SchemaCatalog] Mission declares unknown schema '{}'; using {}",
                        location, schemas.get(0).getFileName());
            }
            return schemas.get(0);
        }

        if (location == null) {
            throw new SchemaViolationException("The mission root element must carry xsi:schemaLocation "
                    + "naming one of the available schemas: " + getSchemaNames());
        }
        throw new SchemaViolationException("The mission declares schema '" + location
                + "', which is not one of the available schemas: " + getSchemaNames());
    }

    /** Schema file contents, each preceded by its file name, for the planner's framing. */
    public String describeSchemas() throws ToolConfigurationException {
        StringBuilder out = new StringBuilder();
        for (Path schema : schemas) {
            try {
                out.append("Schema ").append(schema.getFileName()).append(":\n")
                   .append(Files.readString(schema, StandardCharsets.UTF_8))
                   .append("\n\n");
            } catch (IOException e) {
                throw new ToolConfigurationException("Cannot read schema " + schema + ": " + e.getMessage(), e);
            }
        }
        return out.toString().stripTrailing();
    }

    /** Second token of the first xsi:schemaLocation pair, or null. */
    private String declaredLocation(String missionXml) throws SchemaViolationException {
        Element root;
        try {
            DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
            f.setNamespaceAware(true);
            f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            root = f.newDocumentBuilder()
                    .parse(new InputSource(new StringReader(missionXml)))
                    .getDocumentElement();
        } catch (SAXException | IOException e) {
            throw new SchemaViolationException("Mission is not well-formed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        }

        String attribute = root.getAttributeNS(XSI_NS, "schemaLocation");
        if (attribute == null || attribute.isBlank()) return null;

        String[] tokens = attribute.trim().split("\\s+");
        return tokens.length >= 2 ? tokens[1] : tokens[0];
    }
}
