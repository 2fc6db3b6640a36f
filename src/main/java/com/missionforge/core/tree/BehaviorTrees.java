package com.missionforge.core.tree;

import java.util.List;

/**
 * Traversal helpers over a behavior tree.
 */
public final class BehaviorTrees {

    private BehaviorTrees() {
    }

    /**
     * Number of tasks the compiled model contains: every leaf plus every
     * condition gate that ModelCompiler emits. Parallel subtrees and Fallback
     * branches after the first unconditional alternative are not compiled, so
     * they are not counted either.
     */
    public static int countTasks(BehaviorNode root) {
        if (root == null) return 0;

        return switch (root.getKind()) {
            case LEAF, BOOL_CONDITION, VALUE_CONDITION -> 1;
            case PARALLEL -> 0;
            case SEQUENCE -> countAll(root.getChildren());
            case FALLBACK -> countFallback(root.getChildren());
        };
    }

    private static int countAll(List<BehaviorNode> nodes) {
        int count = 0;
        for (BehaviorNode node : nodes) {
            count += countTasks(node);
        }
        return count;
    }

    // branch grouping follows ModelCompiler.compileFallback
    private static int countFallback(List<BehaviorNode> children) {
        int     count       = 0;
        boolean first       = true;
        boolean elseEmitted = false;

        for (int i = 0; i < children.size(); i++) {
            BehaviorNode child = children.get(i);
            if (child == null) continue;

            if (child.isCondition()) {
                count += 1;
                if (i + 1 < children.size()) {
                    count += countTasks(children.get(i + 1));
                }
                i++;
            } else if (isGatedSequence(child)) {
                count += countTasks(child);
            } else if (first || !elseEmitted) {
                if (!first) elseEmitted = true;
                count += countTasks(child);
            } else {
                continue;
            }
            first = false;
        }
        return count;
    }

    private static boolean isGatedSequence(BehaviorNode node) {
        return node.getKind() == BehaviorNode.Kind.SEQUENCE
                && !node.getChildren().isEmpty()
                && node.getChildren().get(0) != null
                && node.getChildren().get(0).isCondition();
    }
}
