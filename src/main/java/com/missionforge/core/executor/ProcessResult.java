package com.missionforge.core.executor;

/**
 * ProcessResult - outcome of one external tool invocation.
 *
 * Fields:
 *   - exitCode: process exit code, -1 when the process was killed on timeout
 *   - output: stdout and stderr merged in the order the tool wrote them
 *   - timedOut: whether the process exceeded its time limit
 *   - elapsedTimeMs: wall-clock time the execution took
 */
public class ProcessResult {

    private final int     exitCode;
    private final String  output;
    private final boolean timedOut;
    private final long    elapsedTimeMs;

    public ProcessResult(int exitCode, String output, boolean timedOut, long elapsedTimeMs) {
        this.exitCode      = exitCode;
        this.output        = output != null ? output : "";
        this.timedOut      = timedOut;
        this.elapsedTimeMs = elapsedTimeMs;
    }

    public static ProcessResult completed(int exitCode, String output) {
        return new ProcessResult(exitCode, output, false, 0);
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public long getElapsedTimeMs() {
        return elapsedTimeMs;
    }

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }

    @Override
    public String toString() {
        return String.format(
            "ProcessResult{exitCode=%d, outputLen=%d, timedOut=%s, elapsedMs=%d}",
            exitCode,
            output.length(),
            timedOut,
            elapsedTimeMs
        );
    }
}
