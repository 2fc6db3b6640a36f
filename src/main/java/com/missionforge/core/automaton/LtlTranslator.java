package com.missionforge.core.automaton;

import com.missionforge.core.error.PropertySyntaxException;
import com.missionforge.core.error.ToolConfigurationException;

/**
 * Converts an LTL formula (atoms already quoted) into a Büchi automaton.
 */
public interface LtlTranslator {

    Automaton translate(String formula) throws PropertySyntaxException, ToolConfigurationException;
}
