package com.missionforge.core.checker;

import com.missionforge.core.compiler.CompiledProgram;
import com.missionforge.core.error.ModelCheckerExecutionException;
import com.missionforge.core.error.ToolConfigurationException;
import com.missionforge.core.executor.ProcessExecutor;
import com.missionforge.core.executor.ProcessResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * SpinModelChecker: runs SPIN on program + property.
 *
 * Layout inside the session directory:
 *
 *   <workDir>/mission_<id>.pml          program text followed by the property
 *   <workDir>/mission_<id>.pml.trail    counterexample, if SPIN found one
 *   <workDir>/.spin/                    SPIN's generated verifier sources
 *
 * SPIN writes the trail into its current directory (.spin) under the work
 * file's base name; it is moved next to the work file so {@code spin -t}
 * can replay it.
 */
@Component
public class SpinModelChecker implements ModelChecker {

    private static final Logger log = LoggerFactory.getLogger(SpinModelChecker.class);

    private static final String SCRATCH_DIR = ".spin";

    private final ProcessExecutor executor;
    private final String          spinPath;
    private final Duration        timeout;

    public SpinModelChecker(
            ProcessExecutor executor,
            @Value("${mission.spin.path:spin}") String spinPath,
            @Value("${mission.spin.timeout-seconds:0}") long timeoutSeconds
    ) {
        this.executor = executor;
        this.spinPath = spinPath;
        this.timeout  = timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null;

        log.info("[SpinModelChecker] SPIN: {} (timeout: {})", spinPath,
                timeout != null ? timeout.getSeconds() + "s" : "none");
    }

    @Override
    public VerifyResult verify(CompiledProgram program, String property, Path workDir)
            throws ModelCheckerExecutionException, ToolConfigurationException {

        Path scratch;
        Path workFile;
        try {
            scratch = Files.createDirectories(workDir.resolve(SCRATCH_DIR));
            workFile = workDir.resolve("mission_" + UUID.randomUUID().toString().substring(0, 8) + ".pml")
                    .toAbsolutePath();
            Files.writeString(workFile, program.render() + "\n" + property, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ToolConfigurationException("Cannot prepare model-checking files in " + workDir + ": "
                    + e.getMessage(), e);
        }

        log.info("[SpinModelChecker] Verifying {}", workFile.getFileName());

        ProcessResult search = run(List.of(spinPath, "-search", "-a", "-O2", workFile.toString()), scratch);
        if (search.isTimedOut()) {
            throw new ModelCheckerExecutionException("SPIN did not finish within "
                    + timeout.getSeconds() + " seconds:\n" + search.getOutput());
        }
        if (search.getExitCode() != 0) {
            throw new ModelCheckerExecutionException(search.getOutput());
        }

        Path scratchTrail = scratch.resolve(workFile.getFileName() + ".trail");
        if (!Files.isRegularFile(scratchTrail)) {
            log.info("[SpinModelChecker] No counterexample; property holds");
            return VerifyResult.passed(workFile);
        }

        Path trail = Path.of(workFile + ".trail");
        try {
            Files.move(scratchTrail, trail, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new ToolConfigurationException("Cannot relocate trail file " + scratchTrail + ": "
                    + e.getMessage(), e);
        }

        ProcessResult replay = run(List.of(spinPath, "-t", workFile.toString()), workDir);
        if (!replay.isSuccess()) {
            log.error("[SpinModelChecker] Trail replay failed (exit {}): {}",
                    replay.getExitCode(), replay.getOutput());
        }

        log.warn("[SpinModelChecker] Counterexample found for {}", workFile.getFileName());
        return VerifyResult.violated(replay.getOutput(), workFile);
    }

    private ProcessResult run(List<String> command, Path directory) throws ToolConfigurationException {
        try {
            return executor.execute(command, directory, timeout);
        } catch (IOException e) {
            throw new ToolConfigurationException("SPIN executable '" + spinPath + "' could not be run: "
                    + e.getMessage(), e);
        }
    }
}
