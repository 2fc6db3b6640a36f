package com.missionforge.core.automaton;

import com.missionforge.core.error.PropertySyntaxException;
import com.missionforge.core.error.SamplingException;
import com.missionforge.core.error.ToolConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * AutomatonSampler: turns a property into its automaton and draws example
 * accepting runs from it for the arbiter.
 *
 * A run is a random walk from the initial state that only follows edges
 * leaving the current state, so every step is a visible task transition.
 */
@Component
public class AutomatonSampler {

    private static final Logger log = LoggerFactory.getLogger(AutomatonSampler.class);

    private final LtlTranslator translator;
    private final boolean       initiallyFalse;
    private final int           maxSteps;
    private final Random        random;

    @Autowired
    public AutomatonSampler(
            LtlTranslator translator,
            @Value("${mission.property.initially-false:true}") boolean initiallyFalse,
            @Value("${mission.sampler.max-steps:1000}") int maxSteps
    ) {
        this(translator, initiallyFalse, maxSteps, new Random());
    }

    public AutomatonSampler(LtlTranslator translator, boolean initiallyFalse, int maxSteps, Random random) {
        this.translator     = translator;
        this.initiallyFalse = initiallyFalse;
        this.maxSteps       = maxSteps;
        this.random         = random;
    }

    public Automaton translate(String propertyText) throws PropertySyntaxException, ToolConfigurationException {
        String formula = PropertyText.toTranslatorFormula(propertyText, initiallyFalse);
        log.debug("[Sampler] Translating {}", formula);
        return translator.translate(formula);
    }

    public AcceptingRun sampleAcceptingRun(Automaton automaton) throws SamplingException {
        int          state  = automaton.getInitialState();
        List<String> labels = new ArrayList<>();

        do {
            List<Automaton.Edge> progress = automaton.progressEdges(state);

            if (progress.isEmpty()) {
                if (automaton.isAccepting(state) && labels.isEmpty()) {
                    Automaton.Edge selfLoop = firstSelfLoop(automaton, state);
                    if (selfLoop != null) {
                        labels.add(selfLoop.getLabel());
                        break;
                    }
                }
                throw new SamplingException("The property's automaton has no transition out of state " + state
                        + "; no task sequence satisfies the property");
            }

            Automaton.Edge edge = progress.get(random.nextInt(progress.size()));
            labels.add(edge.getLabel());
            state = edge.getDestination();

            if (labels.size() > maxSteps) {
                throw new SamplingException("No accepting state reached within " + maxSteps
                        + " transitions; the property may never be satisfied");
            }
        } while (!automaton.isAccepting(state));

        return new AcceptingRun(labels);
    }

    /** Draw {@code count} runs; each one is sampled independently. */
    public List<AcceptingRun> sampleAcceptingRuns(Automaton automaton, int count) throws SamplingException {
        List<AcceptingRun> runs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            runs.add(sampleAcceptingRun(automaton));
        }
        log.info("[Sampler] Sampled {} accepting runs", runs.size());
        return runs;
    }

    private Automaton.Edge firstSelfLoop(Automaton automaton, int state) {
        for (Automaton.Edge edge : automaton.outgoing(state)) {
            if (edge.isSelfLoop()) return edge;
        }
        return null;
    }
}
