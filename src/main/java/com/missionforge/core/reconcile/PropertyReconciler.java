package com.missionforge.core.reconcile;

import com.missionforge.core.automaton.Automaton;
import com.missionforge.core.tree.BehaviorNode;
import com.missionforge.core.tree.BehaviorTrees;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks that the mission plan and its property talk about the same number of tasks.
 *
 * Mission side: leaves plus condition gates. Property side: automaton
 * transitions that change state. A mismatch means the property was written
 * for a different plan and has to be regenerated.
 */
@Component
public class PropertyReconciler {

    private static final Logger log = LoggerFactory.getLogger(PropertyReconciler.class);

    public int countMissionTasks(BehaviorNode tree) {
        return BehaviorTrees.countTasks(tree);
    }

    public int countPropertyTasks(Automaton automaton) {
        return automaton.countProgressTransitions();
    }

    public void reconcile(int missionTaskCount, int propertyTaskCount) throws PropertyDriftException {
        if (missionTaskCount == propertyTaskCount) {
            log.info("[Reconciler] Task counts agree ({})", missionTaskCount);
            return;
        }

        DriftError drift = new DriftError(missionTaskCount, propertyTaskCount);
        log.warn("[Reconciler] Drift detected: {}", drift);
        throw new PropertyDriftException(drift);
    }

    public void reconcile(BehaviorNode tree, Automaton automaton) throws PropertyDriftException {
        reconcile(countMissionTasks(tree), countPropertyTasks(automaton));
    }
}
