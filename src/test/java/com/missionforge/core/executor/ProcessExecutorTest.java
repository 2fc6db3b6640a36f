package com.missionforge.core.executor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessExecutorTest {

    @TempDir
    Path tempDir;

    private final ProcessExecutor executor = new ProcessExecutor();

    @Test
    void testLongOutputIsReadToTheEnd() throws Exception {
        ProcessResult result = executor.execute(List.of("sh", "-c",
                "i=0; while [ $i -lt 20000 ]; do echo \"step $i\"; i=$((i+1)); done; echo trail-end"),
                tempDir, null);

        assertTrue(result.isSuccess());
        assertFalse(result.isTimedOut());
        assertTrue(result.getOutput().endsWith("step 19999\ntrail-end\n"));
        assertEquals(20001, result.getOutput().split("\n").length);
    }

    @Test
    void testStderrIsMergedAndExitCodeKept() throws Exception {
        ProcessResult result = executor.execute(List.of("sh", "-c", "echo oops >&2; exit 3"), tempDir, null);

        assertEquals(3, result.getExitCode());
        assertFalse(result.isSuccess());
        assertEquals("oops\n", result.getOutput());
    }

    @Test
    void testTimeoutKillsProcess() throws Exception {
        ProcessResult result = executor.execute(List.of("sh", "-c", "sleep 30"), tempDir, Duration.ofMillis(200));

        assertTrue(result.isTimedOut());
        assertEquals(-1, result.getExitCode());
    }

    @Test
    void testMissingExecutable() {
        assertThrows(IOException.class,
                () -> executor.execute(List.of("no-such-tool-for-missions"), tempDir, null));
    }
}
