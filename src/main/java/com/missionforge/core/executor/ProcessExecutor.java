package com.missionforge.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external verification tools (SPIN, the LTL translator) as child processes.
 *
 * Tests replace this with a subclass that fakes the tool.
 */
@Component
public class ProcessExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutor.class);

    /**
     * @param command   executable followed by its arguments
     * @param directory working directory of the child process
     * @param timeout   time limit, or null to wait indefinitely
     * @throws IOException when the executable cannot be started
     */
    public ProcessResult execute(List<String> command, Path directory, Duration timeout)
            throws IOException {

        long startTime = System.currentTimeMillis();
        log.info("[ProcessExecutor] Executing: {} (in {})", String.join(" ", command), directory);

        ProcessBuilder builder = new ProcessBuilder(command);
        if (directory != null) {
            builder.directory(directory.toFile());
        }
        // tool diagnostics are fed back verbatim, so keep stderr in line with stdout
        builder.redirectErrorStream(true);

        Process process = builder.start();

        StringBuilder output = new StringBuilder();

        Thread outThread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (output) {
                        output.append(line).append("\n");
                    }
                }
            } catch (IOException e) {
                log.warn("[ProcessExecutor] Error reading output: {}", e.getMessage());
            }
        }, "process-output-" + command.get(0));

        outThread.start();

        try {
            boolean finished;
            if (timeout == null) {
                process.waitFor();
                finished = true;
            } else {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }

            if (!finished) {
                process.destroyForcibly();
                outThread.join(1000);
                log.warn("[ProcessExecutor] Process timed out after {}", timeout);
                return new ProcessResult(-1, snapshot(output), true,
                        System.currentTimeMillis() - startTime);
            }

            // the stream closes once the process is gone; drain it fully
            outThread.join();

        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for " + command.get(0), e);
        }

        ProcessResult result = new ProcessResult(
                process.exitValue(),
                snapshot(output),
                false,
                System.currentTimeMillis() - startTime
        );

        log.info("[ProcessExecutor] Exit code: {}, Output length: {} chars",
                result.getExitCode(), result.getOutput().length());

        return result;
    }

    private static String snapshot(StringBuilder output) {
        synchronized (output) {
            return output.toString();
        }
    }
}
