package com.missionforge.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Knobs of the verification loop, read once at startup.
 */
@Component
public class VerificationSettings {

    private final int     maxRetries;
    private final int     sampleRuns;
    private final boolean reconcile;
    private final boolean lintXml;

    public VerificationSettings(
        @Value("${mission.verification.max-retries:10}") int maxRetries,
        @Value("${mission.verification.sample-runs:5}") int sampleRuns,
        @Value("${mission.verification.reconcile:true}") boolean reconcile,
        @Value("${mission.schema.lint:true}") boolean lintXml
    ) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("mission.verification.max-retries must be >= 0, was " + maxRetries);
        }
        if (sampleRuns < 1) {
            throw new IllegalArgumentException("mission.verification.sample-runs must be >= 1, was " + sampleRuns);
        }
        this.maxRetries = maxRetries;
        this.sampleRuns = sampleRuns;
        this.reconcile  = reconcile;
        this.lintXml    = lintXml;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getSampleRuns() {
        return sampleRuns;
    }

    public boolean isReconcile() {
        return reconcile;
    }

    public boolean isLintXml() {
        return lintXml;
    }
}
