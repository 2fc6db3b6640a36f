package com.missionforge.orchestrator.dto;

import java.util.List;

public class MissionResult {

    private final String       sessionId;
    private final boolean      success;
    private final String       finalState;
    private final int          retries;
    private final String       missionPath;
    private final String       diagnostic;
    private final List<String> sampledRuns;

    public MissionResult(
            String       sessionId,
            boolean      success,
            String       finalState,
            int          retries,
            String       missionPath,
            String       diagnostic,
            List<String> sampledRuns
    ) {
        this.sessionId   = sessionId;
        this.success     = success;
        this.finalState  = finalState;
        this.retries     = retries;
        this.missionPath = missionPath;
        this.diagnostic  = diagnostic;
        this.sampledRuns = sampledRuns != null ? List.copyOf(sampledRuns) : List.of();
    }

    public String getSessionId() {
        return sessionId;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getFinalState() {
        return finalState;
    }

    public int getRetries() {
        return retries;
    }

    /** Written mission.xml; null unless the session succeeded. */
    public String getMissionPath() {
        return missionPath;
    }

    /** Last diagnostic; null on success. */
    public String getDiagnostic() {
        return diagnostic;
    }

    public List<String> getSampledRuns() {
        return sampledRuns;
    }
}
