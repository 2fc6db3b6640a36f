package com.missionforge.core.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Automaton: Büchi automaton of an LTL property, as produced by the translator.
 *
 * States are numbered 0..stateCount-1. Edge labels are already rendered as
 * boolean formulas over the atomic proposition names.
 */
public class Automaton {

    private final int          stateCount;
    private final int          initialState;
    private final Set<Integer> acceptingStates;
    private final List<String> atomicPropositions;
    private final List<Edge>   edges;

    public Automaton(
            int          stateCount,
            int          initialState,
            Set<Integer> acceptingStates,
            List<String> atomicPropositions,
            List<Edge>   edges
    ) {
        this.stateCount         = stateCount;
        this.initialState       = initialState;
        this.acceptingStates    = Collections.unmodifiableSet(new LinkedHashSet<>(acceptingStates));
        this.atomicPropositions = List.copyOf(atomicPropositions);
        this.edges              = List.copyOf(edges);
    }

    public int getStateCount()                 { return stateCount; }
    public int getInitialState()               { return initialState; }
    public Set<Integer> getAcceptingStates()   { return acceptingStates; }
    public List<String> getAtomicPropositions() { return atomicPropositions; }
    public List<Edge> getEdges()               { return edges; }

    public boolean isAccepting(int state) {
        return acceptingStates.contains(state);
    }

    public List<Edge> outgoing(int state) {
        List<Edge> out = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.getSource() == state) out.add(edge);
        }
        return out;
    }

    /** Edges that leave their source state; each one stands for a task step. */
    public List<Edge> progressEdges(int state) {
        return outgoing(state).stream()
                .filter(e -> !e.isSelfLoop())
                .collect(Collectors.toList());
    }

    public int countProgressTransitions() {
        return (int) edges.stream().filter(e -> !e.isSelfLoop()).count();
    }

    @Override
    public String toString() {
        return String.format("Automaton{states=%d, initial=%d, accepting=%s, edges=%d}",
                stateCount, initialState, acceptingStates, edges.size());
    }

    public static final class Edge {

        private final int    source;
        private final int    destination;
        private final String label;

        public Edge(int source, int destination, String label) {
            this.source      = source;
            this.destination = destination;
            this.label       = label;
        }

        public int getSource()      { return source; }
        public int getDestination() { return destination; }
        public String getLabel()    { return label; }

        public boolean isSelfLoop() {
            return source == destination;
        }

        @Override
        public String toString() {
            return source + " -[" + label + "]-> " + destination;
        }
    }
}
