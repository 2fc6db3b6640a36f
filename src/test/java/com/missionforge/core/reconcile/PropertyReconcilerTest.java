package com.missionforge.core.reconcile;

import com.missionforge.core.automaton.Automaton;
import com.missionforge.core.compiler.CompiledProgram;
import com.missionforge.core.compiler.ModelCompiler;
import com.missionforge.core.compiler.PromelaTemplate;
import com.missionforge.core.tree.BehaviorNode;
import com.missionforge.core.tree.Comparator;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PropertyReconcilerTest {

    private final PropertyReconciler reconciler = new PropertyReconciler();

    @Test
    void testEqualCountsPass() {
        assertDoesNotThrow(() -> reconciler.reconcile(5, 5));
    }

    @Test
    void testPropertyWithMoreTasks() {
        PropertyDriftException e = assertThrows(PropertyDriftException.class,
                () -> reconciler.reconcile(5, 7));

        assertEquals(DriftError.Direction.MORE, e.getDrift().getMoreOrFewer());
        assertEquals(2, e.getDrift().getDelta());
        assertTrue(e.getMessage().contains("2 more task(s)"));
    }

    @Test
    void testPropertyWithFewerTasks() {
        PropertyDriftException e = assertThrows(PropertyDriftException.class,
                () -> reconciler.reconcile(7, 5));

        assertEquals(DriftError.Direction.FEWER, e.getDrift().getMoreOrFewer());
        assertEquals(2, e.getDrift().getDelta());
        assertTrue(e.getMessage().contains("2 fewer task(s)"));
    }

    @Test
    void testCountsFromTreeAndAutomaton() {
        BehaviorNode tree = BehaviorNode.sequence(
                BehaviorNode.leaf("T1", "move"),
                BehaviorNode.fallback(
                        BehaviorNode.valueCondition("temp", Comparator.GT, 30),
                        BehaviorNode.leaf("T2", "move"),
                        BehaviorNode.leaf("T3", "move")
                )
        );

        Automaton automaton = new Automaton(3, 0, Set.of(2), List.of("a", "b"), List.of(
                new Automaton.Edge(0, 0, "!a"),
                new Automaton.Edge(0, 1, "a"),
                new Automaton.Edge(1, 1, "!b"),
                new Automaton.Edge(1, 2, "b"),
                new Automaton.Edge(2, 2, "1")
        ));

        assertEquals(4, reconciler.countMissionTasks(tree));
        assertEquals(2, reconciler.countPropertyTasks(automaton));

        PropertyDriftException e = assertThrows(PropertyDriftException.class,
                () -> reconciler.reconcile(tree, automaton));
        assertEquals(DriftError.Direction.FEWER, e.getDrift().getMoreOrFewer());
    }

    @Test
    void testUncompiledNodesAreNotCounted() throws Exception {
        BehaviorNode tree = BehaviorNode.sequence(
                BehaviorNode.leaf("T1", "move"),
                BehaviorNode.parallel(List.of(
                        BehaviorNode.leaf("P1", "move"),
                        BehaviorNode.leaf("P2", "move")
                )),
                BehaviorNode.fallback(
                        BehaviorNode.leaf("Primary", "move"),
                        BehaviorNode.leaf("Alternate", "move"),
                        BehaviorNode.leaf("Unreachable", "move")
                )
        );

        CompiledProgram program = new ModelCompiler(PromelaTemplate.of("")).compile(tree);
        assertEquals(List.of("T1", "Primary", "Alternate"), program.getTaskNames());

        Automaton automaton = new Automaton(4, 0, Set.of(3), List.of("a", "b", "c"), List.of(
                new Automaton.Edge(0, 1, "a"),
                new Automaton.Edge(1, 2, "b"),
                new Automaton.Edge(2, 3, "c"),
                new Automaton.Edge(3, 3, "1")
        ));

        assertEquals(3, reconciler.countMissionTasks(tree));
        assertDoesNotThrow(() -> reconciler.reconcile(tree, automaton));
    }
}
