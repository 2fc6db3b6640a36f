package com.missionforge.core.state;

/**
 * Phase graph of one verification session.
 *
 * NEED_XML → NEED_LTL → NEED_RECONCILE → NEED_MODEL_CHECK → NEED_ARBITER → NEED_TRAIL_CHECK → DONE
 *
 * NEED_XML          generate the mission, validate it, parse and compile it.
 *                   Failure retries here with the diagnostic.
 * NEED_LTL          generate the property from the compiled names and translate it.
 *                   Failure retries here.
 * NEED_RECONCILE    mission and property task counts must agree. Drift → NEED_LTL.
 * NEED_MODEL_CHECK  run SPIN; the result is kept for NEED_TRAIL_CHECK.
 *                   Tool failure → NEED_LTL.
 * NEED_ARBITER      sample accepting runs and ask the arbiter. Rejection → NEED_LTL.
 * NEED_TRAIL_CHECK  counterexample → NEED_XML (the mission is blamed); none → DONE.
 *
 * DONE and FAILED are terminal. Every backward edge spends one retry of the
 * shared budget; with the budget spent the session goes to FAILED instead.
 */
public enum VerificationState {
    NEED_XML,
    NEED_LTL,
    NEED_RECONCILE,
    NEED_MODEL_CHECK,
    NEED_ARBITER,
    NEED_TRAIL_CHECK,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
