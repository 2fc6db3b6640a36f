package com.missionforge.core.automaton;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites a SPIN-style LTL property into a formula the translator accepts.
 *
 *   ltl mission { [](T1.action.actionType == move -> <> temp > 30) }
 *     → []("T1.action.actionType == move" -> <> "temp > 30")
 *
 * Quoted text already present in the formula is left untouched.
 */
public final class PropertyText {

    private static final Pattern LABELLED = Pattern.compile(
            "^\\s*ltl(?:\\s+[A-Za-z_][A-Za-z0-9_]*)?\\s*\\{(.*)\\}\\s*$", Pattern.DOTALL);
    private static final Pattern RELATION = Pattern.compile(
            "([A-Za-z_][\\w.\\[\\]]*)\\s*(==|!=|<=|>=|<|>)\\s*(-?[\\w.]+)");
    private static final Pattern QUOTED   = Pattern.compile("\"[^\"]*\"");

    private PropertyText() {
    }

    /** Body of an {@code ltl name { … }} block, or the trimmed text when unlabelled. */
    public static String stripLabel(String property) {
        if (property == null) return "";
        Matcher m = LABELLED.matcher(property);
        return m.matches() ? m.group(1).trim() : property.trim();
    }

    /** Wrap every relational atom outside existing quotes in double quotes. */
    public static String quoteAtoms(String formula) {
        StringBuilder out = new StringBuilder();
        Matcher quoted = QUOTED.matcher(formula);
        int last = 0;
        while (quoted.find()) {
            out.append(quoteRelations(formula.substring(last, quoted.start())));
            out.append(quoted.group());
            last = quoted.end();
        }
        out.append(quoteRelations(formula.substring(last)));
        return out.toString();
    }

    /** Distinct quoted propositions, in order of first appearance. */
    public static List<String> quotedAtoms(String formula) {
        Set<String> atoms = new LinkedHashSet<>();
        Matcher m = QUOTED.matcher(formula);
        while (m.find()) {
            atoms.add(m.group());
        }
        return new ArrayList<>(atoms);
    }

    /**
     * Full rewrite: strip the label, quote atoms, and, when requested, conjoin
     * the requirement that every proposition starts out false.
     */
    public static String toTranslatorFormula(String property, boolean initiallyFalse) {
        String formula = quoteAtoms(stripLabel(property));
        if (!initiallyFalse) return formula;

        List<String> atoms = quotedAtoms(formula);
        if (atoms.isEmpty()) return formula;

        StringBuilder out = new StringBuilder();
        for (String atom : atoms) {
            out.append('!').append(atom).append(" && ");
        }
        return out.append('(').append(formula).append(')').toString();
    }

    private static String quoteRelations(String segment) {
        Matcher m = RELATION.matcher(segment);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String atom = m.group(1) + " " + m.group(2) + " " + m.group(3);
            m.appendReplacement(out, Matcher.quoteReplacement("\"" + atom + "\""));
        }
        m.appendTail(out);
        return out.toString();
    }
}
