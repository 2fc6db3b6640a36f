package com.missionforge.core.compiler;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * CompiledProgram: Promela model of one mission, split into the sections
 * the compiler produces.
 *
 * render() assembles them in the order SPIN's parser needs:
 *   preamble → task declarations → global declarations → sensor selectors → init
 *
 * INVARIANTS:
 *   - every global referenced in initBlock appears exactly once in globalDeclarations
 *   - each sensor selector helper appears once, however many conditions use it
 */
public class CompiledProgram {

    private static final String INDENT = "    ";

    private final String       preamble;
    private final List<String> taskDeclarations;
    private final Set<String>  globalDeclarations;
    private final Set<String>  sensorSelectors;
    private final String       initBlock;
    private final List<String> taskNames;
    private final List<String> globalNames;

    public CompiledProgram(
            String       preamble,
            List<String> taskNames,
            List<String> globalNames,
            Set<String>  sensorSelectors,
            String       initBlock
    ) {
        this.preamble    = preamble != null ? preamble : "";
        this.taskNames   = List.copyOf(taskNames);
        this.globalNames = List.copyOf(globalNames);
        this.initBlock   = initBlock != null ? initBlock : "";

        this.taskDeclarations = this.taskNames.stream()
                .map(name -> "Task " + name + ";")
                .collect(Collectors.toUnmodifiableList());

        Set<String> globals = new LinkedHashSet<>();
        for (String name : this.globalNames) {
            globals.add("int " + name + ";");
        }
        this.globalDeclarations = Collections.unmodifiableSet(globals);
        this.sensorSelectors    = Collections.unmodifiableSet(new LinkedHashSet<>(sensorSelectors));
    }

    public String getPreamble()               { return preamble; }
    public List<String> getTaskDeclarations() { return taskDeclarations; }
    public Set<String> getGlobalDeclarations() { return globalDeclarations; }
    public Set<String> getSensorSelectors()   { return sensorSelectors; }
    public String getInitBlock()              { return initBlock; }

    /** Task identifiers in first-seen order; handed to the property generator. */
    public List<String> getTaskNames()        { return taskNames; }

    /** Condition variables in first-seen order. */
    public List<String> getGlobalNames()      { return globalNames; }

    /**
     * Full program text. Whitespace is significant to downstream tooling that
     * diffs models, so keep this byte-stable for identical input.
     */
    public String render() {
        StringBuilder out = new StringBuilder();

        String header = preamble.stripTrailing();
        if (!header.isEmpty()) {
            out.append(header).append("\n\n");
        }

        for (String declaration : taskDeclarations) {
            out.append(declaration).append("\n");
        }
        if (!taskDeclarations.isEmpty()) {
            out.append("\n");
        }

        for (String declaration : globalDeclarations) {
            out.append(declaration).append("\n");
        }
        if (!globalDeclarations.isEmpty()) {
            out.append("\n");
        }

        for (String selector : sensorSelectors) {
            out.append(selector).append("\n\n");
        }

        out.append("init {\n");
        out.append(INDENT).append("atomic {\n");
        out.append(initBlock);
        out.append(INDENT).append("}\n");
        out.append("}\n");

        return out.toString();
    }

    @Override
    public String toString() {
        return String.format("CompiledProgram{tasks=%d, globals=%d, selectors=%d}",
                taskDeclarations.size(), globalDeclarations.size(), sensorSelectors.size());
    }
}
