package com.missionforge.core.compiler;

import com.missionforge.core.error.StructuralCompileException;
import com.missionforge.core.tree.BehaviorNode;
import com.missionforge.core.tree.TaskNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * ModelCompiler: lowers a mission behavior tree into a Promela program.
 *
 * Encoding:
 *   Sequence        → children in order
 *   Fallback        → if … fi; condition-gated branches get their guard, the first
 *                     ungated non-first branch becomes "else", and a choice made only
 *                     of gated branches is closed with ":: else -> skip"
 *   Leaf            → "Task <id>;" declaration + actionType assignment, plus
 *                     parameter1/parameter2 for the parameters the Action typedef holds
 *   Bool/Value cond → nondeterministic select() into an int global, then a guard
 *   Parallel        → not supported; compiled as nothing (warning logged)
 *
 * Each recursive call returns a Fragment that the caller merges, so no state
 * outlives a compile() call and identical trees render identically.
 */
@Component
public class ModelCompiler {

    private static final Logger log = LoggerFactory.getLogger(ModelCompiler.class);

    private static final String  INDENT      = "    ";
    private static final int     INIT_INDENT = 2;
    private static final Pattern IDENTIFIER  = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Action fields of the template's typedef. Coordinates are stored in
     * units of 1e-5 degree; sample and picture counts as they are.
     */
    private static final Map<String, ParameterSlot> PARAMETER_SLOTS = Map.of(
            "Latitude",         new ParameterSlot("parameter1", 5),
            "Longitude",        new ParameterSlot("parameter2", 5),
            "numberOfPictures", new ParameterSlot("parameter1", 0),
            "numberOfSamples",  new ParameterSlot("parameter1", 0)
    );

    private final PromelaTemplate template;

    public ModelCompiler(PromelaTemplate template) {
        this.template = template;
    }

    // =========================================================================
    // Entry point
    // =========================================================================

    public CompiledProgram compile(BehaviorNode root) throws StructuralCompileException {
        if (root == null) {
            throw new StructuralCompileException("Mission has no behavior tree");
        }

        Fragment fragment = compileNode(root, INIT_INDENT);

        Set<String> selectors = new LinkedHashSet<>();
        for (String variable : fragment.globals) {
            selectors.add(selectorHelper(variable));
        }

        CompiledProgram program = new CompiledProgram(
                template.getHeader(),
                new ArrayList<>(fragment.tasks),
                new ArrayList<>(fragment.globals),
                selectors,
                String.join("", fragment.lines)
        );

        log.info("[Compiler] Compiled {}", program);
        return program;
    }

    // =========================================================================
    // Recursion
    // =========================================================================

    private Fragment compileNode(BehaviorNode node, int indent) throws StructuralCompileException {
        if (node == null) {
            throw new StructuralCompileException("Behavior tree contains an empty node");
        }

        return switch (node.getKind()) {
            case SEQUENCE        -> compileSequence(node.getChildren(), indent);
            case FALLBACK        -> compileFallback(node.getChildren(), indent);
            case PARALLEL        -> skipParallel(node);
            case LEAF            -> compileLeaf((BehaviorNode.Leaf) node, indent);
            case BOOL_CONDITION,
                 VALUE_CONDITION -> throw new StructuralCompileException(
                    "Condition " + node + " has no following sibling to gate");
        };
    }

    private Fragment compileSequence(List<BehaviorNode> children, int indent)
            throws StructuralCompileException {

        Fragment fragment = new Fragment();

        for (int i = 0; i < children.size(); i++) {
            BehaviorNode child = children.get(i);

            if (child != null && child.isCondition()) {
                // outside a Fallback the gate becomes a one-branch choice
                BehaviorNode gated = successorOf(children, i);
                Branch branch = new Branch(child, List.of(gated));
                fragment.merge(emitChoice(List.of(branch), indent));
                i++;
                continue;
            }

            fragment.merge(compileNode(child, indent));
        }

        return fragment;
    }

    private Fragment compileFallback(List<BehaviorNode> children, int indent)
            throws StructuralCompileException {

        if (children.isEmpty()) {
            throw new StructuralCompileException("Fallback node has no children");
        }

        List<Branch> branches = new ArrayList<>();

        for (int i = 0; i < children.size(); i++) {
            BehaviorNode child = children.get(i);

            if (child != null && child.isCondition()) {
                branches.add(new Branch(child, List.of(successorOf(children, i))));
                i++;
            } else if (child != null
                    && child.getKind() == BehaviorNode.Kind.SEQUENCE
                    && !child.getChildren().isEmpty()
                    && child.getChildren().get(0) != null
                    && child.getChildren().get(0).isCondition()) {
                List<BehaviorNode> rest = child.getChildren().subList(1, child.getChildren().size());
                if (rest.isEmpty()) {
                    throw new StructuralCompileException(
                            "Condition " + child.getChildren().get(0) + " has no following sibling to gate");
                }
                branches.add(new Branch(child.getChildren().get(0), rest));
            } else if (child != null) {
                branches.add(new Branch(null, List.of(child)));
            } else {
                throw new StructuralCompileException("Fallback node contains an empty child");
            }
        }

        return emitChoice(branches, indent);
    }

    /**
     * Emit selector calls, then the if … fi block for the given branches.
     */
    private Fragment emitChoice(List<Branch> branches, int indent) throws StructuralCompileException {
        Fragment fragment = new Fragment();

        // one select per variable, covering every threshold this choice tests
        Map<String, int[]> ranges = new LinkedHashMap<>();
        for (Branch branch : branches) {
            if (branch.gate == null) continue;
            String variable = conditionVariable(branch.gate);
            int[]  range    = selectionRange(branch.gate);
            ranges.merge(variable, range, (a, b) -> new int[] {
                    Math.min(a[0], b[0]), Math.max(a[1], b[1]) });
            fragment.globals.add(variable);
        }
        for (Map.Entry<String, int[]> entry : ranges.entrySet()) {
            fragment.line(indent, String.format("select_%s(%d, %d);",
                    entry.getKey(), entry.getValue()[0], entry.getValue()[1]));
        }

        fragment.line(indent, "if");

        boolean first       = true;
        boolean elseEmitted = false;
        boolean allGated    = true;

        for (Branch branch : branches) {
            if (branch.gate != null) {
                fragment.line(indent, ":: " + guard(branch.gate) + " ->");
            } else if (first) {
                allGated = false;
                fragment.line(indent, "::");
            } else if (!elseEmitted) {
                allGated = false;
                elseEmitted = true;
                fragment.line(indent, ":: else ->");
            } else {
                log.warn("[Compiler] Fallback branch {} follows an unconditional branch and is unreachable; skipped",
                        branch.body);
                continue;
            }

            Fragment body = compileSequence(branch.body, indent + 1);
            if (body.lines.isEmpty()) {
                body.line(indent + 1, "skip;");
            }
            fragment.merge(body);
            first = false;
        }

        if (allGated) {
            fragment.line(indent, ":: else -> skip");
        }

        fragment.line(indent, "fi;");
        return fragment;
    }

    private Fragment compileLeaf(BehaviorNode.Leaf leaf, int indent) throws StructuralCompileException {
        TaskNode task = leaf.getTask();
        if (task == null) {
            throw new StructuralCompileException("Leaf node has no task");
        }
        requireIdentifier(task.getId(), "task id");
        requireIdentifier(task.getActionType(), "action type of task " + task.getId());

        Fragment fragment = new Fragment();
        fragment.tasks.add(task.getId());
        fragment.line(indent, task.getId() + ".action.actionType = " + task.getActionType() + ";");

        for (Map.Entry<String, String> parameter : task.getParameters().entrySet()) {
            ParameterSlot slot = PARAMETER_SLOTS.get(parameter.getKey());
            if (slot == null) {
                log.debug("[Compiler] Parameter {} of task {} has no slot in Action; not modelled",
                        parameter.getKey(), task.getId());
                continue;
            }
            fragment.line(indent, task.getId() + ".action." + slot.field + " = "
                    + slot.scaled(task.getId(), parameter.getKey(), parameter.getValue()) + ";");
        }
        return fragment;
    }

    private Fragment skipParallel(BehaviorNode node) {
        log.warn("[Compiler] Parallel node with {} children is not supported and was not compiled",
                node.getChildren().size());
        return new Fragment();
    }

    // =========================================================================
    // Conditions
    // =========================================================================

    private String conditionVariable(BehaviorNode condition) throws StructuralCompileException {
        String variable = switch (condition.getKind()) {
            case BOOL_CONDITION  -> ((BehaviorNode.BoolCondition) condition).getVariable();
            case VALUE_CONDITION -> ((BehaviorNode.ValueCondition) condition).getVariable();
            case SEQUENCE, FALLBACK, PARALLEL, LEAF -> throw new StructuralCompileException(
                    "Not a condition: " + condition);
        };
        requireIdentifier(variable, "condition variable");
        return variable;
    }

    /** Inclusive bounds of the nondeterministic sensor reading. */
    private int[] selectionRange(BehaviorNode condition) throws StructuralCompileException {
        return switch (condition.getKind()) {
            case BOOL_CONDITION  -> new int[] { 0, 1 };
            case VALUE_CONDITION -> {
                int threshold = ((BehaviorNode.ValueCondition) condition).getThreshold();
                yield new int[] { threshold - 1, threshold + 1 };
            }
            case SEQUENCE, FALLBACK, PARALLEL, LEAF -> throw new StructuralCompileException(
                    "Not a condition: " + condition);
        };
    }

    private String guard(BehaviorNode condition) throws StructuralCompileException {
        String variable = conditionVariable(condition);
        return switch (condition.getKind()) {
            case BOOL_CONDITION -> variable + " == "
                    + (((BehaviorNode.BoolCondition) condition).getExpected() ? 1 : 0);
            case VALUE_CONDITION -> {
                BehaviorNode.ValueCondition value = (BehaviorNode.ValueCondition) condition;
                if (value.getComparator() == null) {
                    throw new StructuralCompileException("Value condition on " + variable + " has no comparator");
                }
                yield variable + " " + value.getComparator().getSymbol() + " " + value.getThreshold();
            }
            case SEQUENCE, FALLBACK, PARALLEL, LEAF -> throw new StructuralCompileException(
                    "Not a condition: " + condition);
        };
    }

    private String selectorHelper(String variable) {
        return "inline select_" + variable + "(lo, hi) {\n"
                + INDENT + "select(" + variable + " : lo .. hi);\n"
                + "}";
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private BehaviorNode successorOf(List<BehaviorNode> siblings, int conditionIndex)
            throws StructuralCompileException {
        if (conditionIndex + 1 >= siblings.size()) {
            throw new StructuralCompileException(
                    "Condition " + siblings.get(conditionIndex) + " has no following sibling to gate");
        }
        BehaviorNode successor = siblings.get(conditionIndex + 1);
        if (successor == null) {
            throw new StructuralCompileException("Behavior tree contains an empty node");
        }
        if (successor.isCondition()) {
            throw new StructuralCompileException(
                    "Condition " + siblings.get(conditionIndex) + " is followed by another condition");
        }
        return successor;
    }

    private void requireIdentifier(String value, String what) throws StructuralCompileException {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new StructuralCompileException("Invalid " + what + ": '" + value + "'");
        }
    }

    private static final class Branch {
        private final BehaviorNode       gate;
        private final List<BehaviorNode> body;

        private Branch(BehaviorNode gate, List<BehaviorNode> body) {
            this.gate = gate;
            this.body = body;
        }
    }

    private static final class ParameterSlot {
        private final String field;
        private final int    decimalShift;

        private ParameterSlot(String field, int decimalShift) {
            this.field        = field;
            this.decimalShift = decimalShift;
        }

        private int scaled(String taskId, String name, String text) throws StructuralCompileException {
            try {
                return new BigDecimal(text.trim())
                        .movePointRight(decimalShift)
                        .setScale(0, RoundingMode.HALF_UP)
                        .intValueExact();
            } catch (NumberFormatException | ArithmeticException e) {
                throw new StructuralCompileException("Parameter " + name + " of task " + taskId
                        + " is not a number the model can hold: '" + text + "'", e);
            }
        }
    }

    /** Partial output of one subtree. */
    private static final class Fragment {
        private final List<String> lines   = new ArrayList<>();
        private final Set<String>  tasks   = new LinkedHashSet<>();
        private final Set<String>  globals = new LinkedHashSet<>();

        private void line(int indent, String text) {
            lines.add(INDENT.repeat(indent) + text + "\n");
        }

        private void merge(Fragment other) {
            lines.addAll(other.lines);
            tasks.addAll(other.tasks);
            globals.addAll(other.globals);
        }
    }
}
