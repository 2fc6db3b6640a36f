package com.missionforge.core.automaton;

import com.missionforge.core.error.ToolConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HoaParser: reads the Hanoi Omega-Automata text the translator prints for
 * {@code -B -H} (state-based Büchi acceptance, explicit edge labels).
 *
 * Recognised header items: States, Start, AP, Acceptance. Everything else in
 * the header is ignored. In the body:
 *
 *   State: <n> ["name"] [{marks}]     a state; any mark makes it accepting
 *   [<label>] <dst> [{marks}]          an edge of the current state
 *
 * "Acceptance: 0 t" means every state accepts. Labels reference propositions
 * by index and are rendered back with their names: [0&!1] → a & !b.
 */
public final class HoaParser {

    private static final Pattern QUOTED     = Pattern.compile("\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern STATE_LINE = Pattern.compile(
            "State:\\s*(\\d+)(?:\\s+\"(?:[^\"\\\\]|\\\\.)*\")?\\s*(\\{[\\d\\s]*\\})?\\s*");
    private static final Pattern EDGE_LINE  = Pattern.compile(
            "\\[([^\\]]*)\\]\\s*(\\d+)\\s*(\\{[\\d\\s]*\\})?\\s*");
    private static final Pattern SIMPLE_AP  = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private HoaParser() {
    }

    public static Automaton parse(String hoa) throws ToolConfigurationException {
        if (hoa == null || !hoa.contains("--BODY--")) {
            throw new ToolConfigurationException("Translator output is not an HOA automaton:\n" + hoa);
        }

        String[] lines = hoa.split("\\R");

        int          stateCount     = -1;
        int          initialState   = -1;
        boolean      allAccepting   = false;
        List<String> propositions   = new ArrayList<>();
        Set<Integer> accepting      = new LinkedHashSet<>();
        List<Automaton.Edge> edges  = new ArrayList<>();

        int i = 0;

        // ── header ──
        for (; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.equals("--BODY--")) {
                i++;
                break;
            }
            if (line.startsWith("States:")) {
                stateCount = parseInt(line.substring("States:".length()), line);
            } else if (line.startsWith("Start:")) {
                initialState = parseInt(line.substring("Start:".length()), line);
            } else if (line.startsWith("AP:")) {
                Matcher m = QUOTED.matcher(line);
                while (m.find()) {
                    propositions.add(unescape(m.group(1)));
                }
            } else if (line.startsWith("Acceptance:")) {
                String[] parts = line.substring("Acceptance:".length()).trim().split("\\s+", 2);
                allAccepting = parts.length == 2 && parts[0].equals("0") && parts[1].trim().equals("t");
            }
        }

        if (stateCount < 0 || initialState < 0) {
            throw new ToolConfigurationException("HOA header lacks States/Start:\n" + hoa);
        }

        // ── body ──
        int current = -1;
        for (; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) continue;
            if (line.equals("--END--")) break;

            Matcher state = STATE_LINE.matcher(line);
            if (state.matches()) {
                current = Integer.parseInt(state.group(1));
                if (state.group(2) != null && hasMarks(state.group(2))) {
                    accepting.add(current);
                }
                continue;
            }

            Matcher edge = EDGE_LINE.matcher(line);
            if (edge.matches() && current >= 0) {
                edges.add(new Automaton.Edge(
                        current,
                        Integer.parseInt(edge.group(2)),
                        renderLabel(edge.group(1), propositions)));
                continue;
            }

            throw new ToolConfigurationException("Unsupported HOA body line: " + line);
        }

        if (allAccepting) {
            for (int s = 0; s < stateCount; s++) {
                accepting.add(s);
            }
        }

        return new Automaton(stateCount, initialState, accepting, propositions, edges);
    }

    /** Replace proposition indices with names; t/f become 1/0. */
    static String renderLabel(String label, List<String> propositions) throws ToolConfigurationException {
        StringBuilder out = new StringBuilder();
        String text = label.trim();

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (Character.isDigit(c)) {
                int start = i;
                while (i + 1 < text.length() && Character.isDigit(text.charAt(i + 1))) i++;
                int index = Integer.parseInt(text.substring(start, i + 1));
                if (index >= propositions.size()) {
                    throw new ToolConfigurationException("HOA label references unknown proposition " + index);
                }
                out.append(propositionName(propositions.get(index)));
            } else if (c == '&') {
                out.append(" & ");
            } else if (c == '|') {
                out.append(" | ");
            } else if (c == 't') {
                out.append('1');
            } else if (c == 'f') {
                out.append('0');
            } else if (c == '!' || c == '(' || c == ')') {
                out.append(c);
            } else if (!Character.isWhitespace(c)) {
                throw new ToolConfigurationException("Unexpected character '" + c + "' in HOA label [" + label + "]");
            }
        }
        return out.toString();
    }

    private static String propositionName(String ap) {
        return SIMPLE_AP.matcher(ap).matches() ? ap : "\"" + ap + "\"";
    }

    private static boolean hasMarks(String braces) {
        return !braces.substring(1, braces.length() - 1).isBlank();
    }

    private static int parseInt(String value, String line) throws ToolConfigurationException {
        try {
            return Integer.parseInt(value.trim().split("\\s+")[0]);
        } catch (NumberFormatException e) {
            throw new ToolConfigurationException("Malformed HOA header line: " + line, e);
        }
    }

    private static String unescape(String quoted) {
        return quoted.replace("\\\"", "\"").replace("\\\\", "\\");
    }
}
