package com.missionforge.core.agent;

/**
 * Arbiter's answer: accepted when it contains "yes"; rationale is the full answer.
 */
public class ArbiterVerdict {

    private final boolean accepted;
    private final String  rationale;

    public ArbiterVerdict(boolean accepted, String rationale) {
        this.accepted  = accepted;
        this.rationale = rationale != null ? rationale : "";
    }

    public boolean isAccepted()   { return accepted; }
    public String getRationale()  { return rationale; }

    @Override
    public String toString() {
        return "ArbiterVerdict{accepted=" + accepted + "}";
    }
}
