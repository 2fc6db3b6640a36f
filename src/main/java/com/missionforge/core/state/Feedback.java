package com.missionforge.core.state;

import com.missionforge.core.error.FailureKind;
import com.missionforge.core.error.VerificationException;

/**
 * Diagnostic routed to the generator that is blamed for a failure; consumed
 * by that generator's next request.
 */
public class Feedback {

    private final FailureKind kind;
    private final String      diagnostic;

    public Feedback(FailureKind kind, String diagnostic) {
        this.kind       = kind;
        this.diagnostic = diagnostic != null ? diagnostic : "";
    }

    public static Feedback of(VerificationException e) {
        return new Feedback(e.getKind(), e.getMessage());
    }

    public FailureKind getKind()   { return kind; }
    public String getDiagnostic()  { return diagnostic; }

    @Override
    public String toString() {
        return "Feedback{" + kind + ", " + diagnostic.length() + " chars}";
    }
}
