package com.missionforge.core.reconcile;

import com.missionforge.core.error.FailureKind;
import com.missionforge.core.error.VerificationException;

/** Mission and property disagree on the number of tasks. */
public class PropertyDriftException extends VerificationException {

    private final DriftError drift;

    public PropertyDriftException(DriftError drift) {
        super(drift.describe());
        this.drift = drift;
    }

    public DriftError getDrift() {
        return drift;
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.DRIFT;
    }
}
