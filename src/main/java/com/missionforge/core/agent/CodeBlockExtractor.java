package com.missionforge.core.agent;

import com.missionforge.core.error.GenerationFailureException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the first fenced markdown block of a given language out of a model answer:
 *
 *   ```xml
 *   <Mission …>
 *   ```
 */
public final class CodeBlockExtractor {

    private CodeBlockExtractor() {
    }

    public static String extract(String answer, String language) throws GenerationFailureException {
        if (answer == null || answer.isBlank()) {
            throw new GenerationFailureException("The answer was empty. Reply with a ```" + language + " code block.");
        }

        Pattern fence = Pattern.compile("```" + Pattern.quote(language) + "[ \\t]*\\R(.*?)```",
                Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
        Matcher m = fence.matcher(answer);
        if (!m.find()) {
            throw new GenerationFailureException("No ```" + language
                    + " code block found in the answer. Return the complete result inside one ```"
                    + language + " block.");
        }

        String block = m.group(1).trim();
        if (block.isEmpty()) {
            throw new GenerationFailureException("The ```" + language + " code block is empty.");
        }
        return block;
    }
}
