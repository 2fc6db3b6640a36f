package com.missionforge.core.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * PromelaTemplate: the type preamble every compiled program starts with
 * (mtype constants for action types, the Task/Action typedefs).
 *
 * Loaded once at startup and read-only afterwards. The same text primes the
 * property generator so it names Promela objects correctly.
 */
@Component
public class PromelaTemplate {

    private static final Logger log = LoggerFactory.getLogger(PromelaTemplate.class);

    private final String header;

    @Autowired
    public PromelaTemplate(
            @Value("${mission.promela.template:classpath:promela/mission_template.pml}") Resource template
    ) {
        try {
            this.header = template.getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read Promela template: " + template.getDescription(), e);
        }
        log.info("[PromelaTemplate] Loaded {} ({} chars)", template.getDescription(), header.length());
    }

    private PromelaTemplate(String header) {
        this.header = header;
    }

    public static PromelaTemplate of(String header) {
        return new PromelaTemplate(header != null ? header : "");
    }

    public String getHeader() {
        return header;
    }
}
