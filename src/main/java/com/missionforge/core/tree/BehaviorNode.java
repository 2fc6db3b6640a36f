package com.missionforge.core.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * BehaviorNode: one node of a mission behavior tree.
 *
 * The variant set is closed: the only subclasses are the nested ones below
 * (the constructor is private), and every consumer dispatches with a switch
 * expression over {@link Kind}, so adding a variant breaks compilation of
 * every consumer instead of being skipped at runtime.
 *
 *   SEQUENCE         children run in order
 *   FALLBACK         mutually exclusive branches, implicit "otherwise"
 *   PARALLEL         parsed but not compiled (unsupported)
 *   LEAF             one TaskNode
 *   BOOL_CONDITION   sensor reading compared against true/false
 *   VALUE_CONDITION  sensor reading compared against an integer threshold
 *
 * A condition has no successor of its own: it gates the next sibling.
 */
public abstract class BehaviorNode {

    public enum Kind {
        SEQUENCE,
        FALLBACK,
        PARALLEL,
        LEAF,
        BOOL_CONDITION,
        VALUE_CONDITION
    }

    private BehaviorNode() {
    }

    public abstract Kind getKind();

    /** Child nodes; empty for leaves and conditions. */
    public List<BehaviorNode> getChildren() {
        return List.of();
    }

    public boolean isCondition() {
        return getKind() == Kind.BOOL_CONDITION || getKind() == Kind.VALUE_CONDITION;
    }

    // =========================================================================
    // Factories
    // =========================================================================

    public static Sequence sequence(BehaviorNode... children) {
        return new Sequence(List.of(children));
    }

    public static Sequence sequence(List<BehaviorNode> children) {
        return new Sequence(children);
    }

    public static Fallback fallback(BehaviorNode... children) {
        return new Fallback(List.of(children));
    }

    public static Fallback fallback(List<BehaviorNode> children) {
        return new Fallback(children);
    }

    public static Parallel parallel(List<BehaviorNode> children) {
        return new Parallel(children);
    }

    public static Leaf leaf(String id, String actionType) {
        return new Leaf(new TaskNode(id, actionType));
    }

    public static Leaf leaf(TaskNode task) {
        return new Leaf(task);
    }

    public static BoolCondition boolCondition(String variable, boolean expected) {
        return new BoolCondition(variable, expected);
    }

    public static ValueCondition valueCondition(String variable, Comparator comparator, int threshold) {
        return new ValueCondition(variable, comparator, threshold);
    }

    // =========================================================================
    // Variants
    // =========================================================================

    /** Shared base of the three composite variants. */
    public abstract static class Composite extends BehaviorNode {

        private final List<BehaviorNode> children;

        private Composite(List<BehaviorNode> children) {
            // ArrayList copy: List.copyOf rejects nulls, which the compiler reports structurally
            this.children = children != null
                    ? Collections.unmodifiableList(new ArrayList<>(children))
                    : List.of();
        }

        @Override
        public List<BehaviorNode> getChildren() {
            return children;
        }
    }

    public static final class Sequence extends Composite {
        private Sequence(List<BehaviorNode> children) { super(children); }

        @Override public Kind getKind() { return Kind.SEQUENCE; }

        @Override public String toString() { return "Sequence" + getChildren(); }
    }

    public static final class Fallback extends Composite {
        private Fallback(List<BehaviorNode> children) { super(children); }

        @Override public Kind getKind() { return Kind.FALLBACK; }

        @Override public String toString() { return "Fallback" + getChildren(); }
    }

    public static final class Parallel extends Composite {
        private Parallel(List<BehaviorNode> children) { super(children); }

        @Override public Kind getKind() { return Kind.PARALLEL; }

        @Override public String toString() { return "Parallel" + getChildren(); }
    }

    public static final class Leaf extends BehaviorNode {

        private final TaskNode task;

        private Leaf(TaskNode task) {
            this.task = task;
        }

        public TaskNode getTask() {
            return task;
        }

        @Override public Kind getKind() { return Kind.LEAF; }

        @Override public String toString() { return "Leaf(" + (task != null ? task.getId() : null) + ")"; }
    }

    public static final class BoolCondition extends BehaviorNode {

        private final String  variable;
        private final boolean expected;

        private BoolCondition(String variable, boolean expected) {
            this.variable = variable;
            this.expected = expected;
        }

        public String getVariable() {
            return variable;
        }

        public boolean getExpected() {
            return expected;
        }

        @Override public Kind getKind() { return Kind.BOOL_CONDITION; }

        @Override public String toString() { return "BoolCondition(" + variable + " == " + expected + ")"; }
    }

    public static final class ValueCondition extends BehaviorNode {

        private final String     variable;
        private final Comparator comparator;
        private final int        threshold;

        private ValueCondition(String variable, Comparator comparator, int threshold) {
            this.variable   = variable;
            this.comparator = comparator;
            this.threshold  = threshold;
        }

        public String getVariable() {
            return variable;
        }

        public Comparator getComparator() {
            return comparator;
        }

        public int getThreshold() {
            return threshold;
        }

        @Override public Kind getKind() { return Kind.VALUE_CONDITION; }

        @Override
        public String toString() {
            return "ValueCondition(" + variable + " " + (comparator != null ? comparator.getSymbol() : "?")
                    + " " + threshold + ")";
        }
    }
}
