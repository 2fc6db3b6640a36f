package com.missionforge.core.automaton;

import java.util.List;

/**
 * One sampled path from the initial state to an accepting state, as the
 * sequence of edge labels taken. Shown to the arbiter as example behaviour.
 */
public class AcceptingRun {

    private final List<String> labels;

    public AcceptingRun(List<String> labels) {
        this.labels = List.copyOf(labels);
    }

    public List<String> getLabels() {
        return labels;
    }

    public int length() {
        return labels.size();
    }

    @Override
    public String toString() {
        return String.join(" ", labels);
    }
}
