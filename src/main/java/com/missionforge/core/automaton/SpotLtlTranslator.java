package com.missionforge.core.automaton;

import com.missionforge.core.error.PropertySyntaxException;
import com.missionforge.core.error.ToolConfigurationException;
import com.missionforge.core.executor.ProcessExecutor;
import com.missionforge.core.executor.ProcessResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Translates through Spot's {@code ltl2tgba}, asking for a state-based Büchi
 * automaton in HOA format.
 */
@Component
public class SpotLtlTranslator implements LtlTranslator {

    private static final Logger log = LoggerFactory.getLogger(SpotLtlTranslator.class);

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final ProcessExecutor executor;
    private final String          translatorPath;

    public SpotLtlTranslator(
            ProcessExecutor executor,
            @Value("${mission.translator.path:ltl2tgba}") String translatorPath
    ) {
        this.executor       = executor;
        this.translatorPath = translatorPath;

        log.info("[Translator] Using {}", translatorPath);
    }

    @Override
    public Automaton translate(String formula) throws PropertySyntaxException, ToolConfigurationException {
        ProcessResult result;
        try {
            result = executor.execute(List.of(translatorPath, "-B", "-H", "-f", formula), null, TIMEOUT);
        } catch (IOException e) {
            throw new ToolConfigurationException(
                    "LTL translator '" + translatorPath + "' could not be started: " + e.getMessage(), e);
        }

        if (result.isTimedOut()) {
            throw new PropertySyntaxException("Translating the property timed out after "
                    + TIMEOUT.getSeconds() + " seconds; simplify the formula");
        }
        if (result.getExitCode() != 0) {
            log.warn("[Translator] Rejected formula: {}", formula);
            throw new PropertySyntaxException(result.getOutput());
        }

        Automaton automaton = HoaParser.parse(result.getOutput());
        log.debug("[Translator] {}", automaton);
        return automaton;
    }
}
