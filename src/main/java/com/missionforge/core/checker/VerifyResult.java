package com.missionforge.core.checker;

import java.nio.file.Path;

/**
 * Outcome of one model-checking run.
 *
 * ok=false always comes with the replayed counterexample in {@code trail}.
 */
public class VerifyResult {

    private final boolean ok;
    private final String  trail;
    private final Path    workFile;

    private VerifyResult(boolean ok, String trail, Path workFile) {
        this.ok       = ok;
        this.trail    = trail;
        this.workFile = workFile;
    }

    public static VerifyResult passed(Path workFile) {
        return new VerifyResult(true, null, workFile);
    }

    public static VerifyResult violated(String trail, Path workFile) {
        return new VerifyResult(false, trail != null ? trail : "", workFile);
    }

    public boolean isOk()        { return ok; }
    public String getTrail()     { return trail; }
    public Path getWorkFile()    { return workFile; }

    @Override
    public String toString() {
        return "VerifyResult{ok=" + ok + ", trail=" + (trail != null ? trail.length() + " chars" : "none")
                + ", workFile=" + workFile + "}";
    }
}
