package com.missionforge.core.checker;

import com.missionforge.core.compiler.CompiledProgram;
import com.missionforge.core.error.ModelCheckerExecutionException;
import com.missionforge.core.error.ToolConfigurationException;

import java.nio.file.Path;

/**
 * Model-checks a compiled mission against an LTL property.
 */
public interface ModelChecker {

    /**
     * @param program  compiled mission model
     * @param property LTL property text, appended to the program as-is
     * @param workDir  session directory; work files are created inside it
     */
    VerifyResult verify(CompiledProgram program, String property, Path workDir)
            throws ModelCheckerExecutionException, ToolConfigurationException;
}
