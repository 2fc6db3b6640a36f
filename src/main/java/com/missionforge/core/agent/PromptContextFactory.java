package com.missionforge.core.agent;

import com.missionforge.core.compiler.PromelaTemplate;
import com.missionforge.core.error.ToolConfigurationException;
import com.missionforge.core.schema.SchemaCatalog;
import com.missionforge.llm.ChatMessage;
import com.missionforge.llm.Conversation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the initial framing of each role's conversation.
 *
 *   MISSION_PLANNER    → robot schemas + one message per context file
 *   PROPERTY_GENERATOR → Promela datatypes the property must refer to
 *   ARBITER            → nothing; every question is self-contained
 *
 * A fresh Conversation is returned on every call, so sessions never share history.
 */
@Component
public class PromptContextFactory {

    private static final Logger log = LoggerFactory.getLogger(PromptContextFactory.class);

    private final SchemaCatalog   schemaCatalog;
    private final PromelaTemplate promelaTemplate;
    private final List<Path>      contextFiles;

    public PromptContextFactory(
            SchemaCatalog schemaCatalog,
            PromelaTemplate promelaTemplate,
            @Value("${mission.context.files:}") List<String> contextFiles
    ) {
        this.schemaCatalog   = schemaCatalog;
        this.promelaTemplate = promelaTemplate;
        this.contextFiles    = contextFiles.stream()
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .map(Path::of)
                .collect(Collectors.toUnmodifiableList());

        log.info("[PromptContext] {} additional context file(s)", this.contextFiles.size());
    }

    public Conversation create(AgentType role) throws ToolConfigurationException {
        return switch (role) {
            case MISSION_PLANNER    -> missionPlannerFraming();
            case PROPERTY_GENERATOR -> propertyGeneratorFraming();
            case ARBITER            -> Conversation.empty();
        };
    }

    private Conversation missionPlannerFraming() throws ToolConfigurationException {
        List<ChatMessage> framing = new ArrayList<>();
        framing.add(ChatMessage.user(
                "These are the schemas for which you must generate mission plan XML documents. "
                + "The mission must be syntactically correct and validate using an XML linter:\n"
                + schemaCatalog.describeSchemas()));

        for (Path file : contextFiles) {
            try {
                framing.add(ChatMessage.user(
                        "Use this additional file to provide context when generating XML mission plans. "
                        + "The content within should be self explanatory:\n"
                        + Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                throw new ToolConfigurationException("Cannot read context file " + file + ": " + e.getMessage(), e);
            }
        }

        return new Conversation(framing);
    }

    private Conversation propertyGeneratorFraming() {
        return new Conversation(List.of(ChatMessage.user(
                "Here are the Promela datatypes used in the system file. "
                + "You should use these types to construct your LTL:\n"
                + promelaTemplate.getHeader())));
    }
}
