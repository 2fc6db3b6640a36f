package com.missionforge.core.tree;

import com.missionforge.core.error.SchemaViolationException;
import com.missionforge.core.error.StructuralCompileException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * MissionParser: DOM reader for XML mission plans → BehaviorNode tree.
 *
 * Elements are matched by local name so any task namespace works:
 *
 *   <ActionSequence>        container; its first element child is the root node
 *   <Sequence>, <Fallback>, <Parallel>
 *   <AtomicTask>            TaskID + Action/ActionType (+ parameter elements)
 *   <BooleanCondition variable="…" expected="true|false|1|0"/>
 *   <ValueCondition variable="…" comparator="gt" threshold="30"/>
 *
 * Any other element inside the tree is a structural error.
 */
@Component
public class MissionParser {

    private static final Logger log = LoggerFactory.getLogger(MissionParser.class);

    private static final String ACTION_SEQUENCE = "ActionSequence";

    private static final BigDecimal MIN_THRESHOLD = BigDecimal.valueOf(Integer.MIN_VALUE + 1L);
    private static final BigDecimal MAX_THRESHOLD = BigDecimal.valueOf(Integer.MAX_VALUE - 1L);

    public BehaviorNode parse(String missionXml) throws SchemaViolationException, StructuralCompileException {
        Element root = readDocument(missionXml).getDocumentElement();

        Element container = findFirst(root, ACTION_SEQUENCE);
        if (container == null) {
            throw new StructuralCompileException("Mission has no <" + ACTION_SEQUENCE + "> element");
        }

        List<Element> nodes = childElements(container);
        if (nodes.isEmpty()) {
            throw new StructuralCompileException("<" + ACTION_SEQUENCE + "> is empty");
        }
        if (nodes.size() > 1) {
            log.warn("[MissionParser] {} root nodes under <{}>; wrapping them in a Sequence",
                    nodes.size(), ACTION_SEQUENCE);
            List<BehaviorNode> roots = new ArrayList<>();
            for (Element node : nodes) {
                roots.add(parseNode(node));
            }
            return BehaviorNode.sequence(roots);
        }

        BehaviorNode tree = parseNode(nodes.get(0));
        log.info("[MissionParser] Parsed behavior tree with {} tasks", BehaviorTrees.countTasks(tree));
        return tree;
    }

    // =========================================================================
    // Node dispatch
    // =========================================================================

    private BehaviorNode parseNode(Element el) throws StructuralCompileException {
        String tag = localName(el);

        switch (tag) {
            case "Sequence":
                return BehaviorNode.sequence(parseChildren(el));
            case "Fallback":
                return BehaviorNode.fallback(parseChildren(el));
            case "Parallel":
                return BehaviorNode.parallel(parseChildren(el));
            case "AtomicTask":
                return BehaviorNode.leaf(parseTask(el));
            case "BooleanCondition":
                return parseBoolCondition(el);
            case "ValueCondition":
                return parseValueCondition(el);
            default:
                throw new StructuralCompileException("Unsupported behavior tree element <" + tag + ">");
        }
    }

    private List<BehaviorNode> parseChildren(Element el) throws StructuralCompileException {
        List<BehaviorNode> children = new ArrayList<>();
        for (Element child : childElements(el)) {
            children.add(parseNode(child));
        }
        return children;
    }

    private TaskNode parseTask(Element el) throws StructuralCompileException {
        Element idEl     = child(el, "TaskID");
        Element actionEl = child(el, "Action");
        if (idEl == null || actionEl == null) {
            throw new StructuralCompileException("<AtomicTask> requires <TaskID> and <Action>");
        }

        Element typeEl = child(actionEl, "ActionType");
        if (typeEl == null) {
            throw new StructuralCompileException(
                    "<Action> of task " + idEl.getTextContent().trim() + " has no <ActionType>");
        }

        Map<String, String> parameters = new LinkedHashMap<>();
        for (Element param : childElements(actionEl)) {
            if (param != typeEl) {
                collectParameters(param, parameters);
            }
        }

        return new TaskNode(idEl.getTextContent().trim(), typeEl.getTextContent().trim(), parameters);
    }

    private BehaviorNode parseValueCondition(Element el) throws StructuralCompileException {
        String variable  = requireAttribute(el, "variable");
        String mnemonic  = requireAttribute(el, "comparator");
        String threshold = requireAttribute(el, "threshold");

        Comparator comparator;
        try {
            comparator = Comparator.fromMnemonic(mnemonic);
        } catch (IllegalArgumentException e) {
            throw new StructuralCompileException("Unknown comparator '" + mnemonic + "' on " + variable, e);
        }

        return BehaviorNode.valueCondition(variable, comparator, integerThreshold(variable, comparator, threshold));
    }

    private BehaviorNode parseBoolCondition(Element el) throws StructuralCompileException {
        String variable = requireAttribute(el, "variable");
        String expected = requireAttribute(el, "expected").trim();

        // xs:boolean lexical space
        boolean value = switch (expected) {
            case "true", "1"  -> true;
            case "false", "0" -> false;
            default -> throw new StructuralCompileException(
                    "Expected value '" + expected + "' on " + variable + " is not a boolean");
        };
        return BehaviorNode.boolCondition(variable, value);
    }

    /**
     * SPIN has no floats. A fractional threshold is moved to the integer that
     * keeps the comparison's integer solutions: x > 30.5 is x > 30, x < 30.5 is
     * x < 31. Equality against a fraction has no integer counterpart.
     * The sensor selector reads threshold ± 1, so that must stay within int.
     */
    private int integerThreshold(String variable, Comparator comparator, String threshold)
            throws StructuralCompileException {

        BigDecimal decimal;
        try {
            decimal = new BigDecimal(threshold.trim());
        } catch (NumberFormatException e) {
            throw new StructuralCompileException("Threshold '" + threshold + "' on " + variable + " is not a number", e);
        }

        BigDecimal integral = switch (comparator) {
            case GT, LTE -> decimal.setScale(0, RoundingMode.FLOOR);
            case LT, GTE -> decimal.setScale(0, RoundingMode.CEILING);
            case EQ, NEQ -> {
                if (decimal.stripTrailingZeros().scale() > 0) {
                    throw new StructuralCompileException("Threshold '" + threshold + "' on " + variable
                            + " must be a whole number for comparator " + comparator.name().toLowerCase(Locale.ROOT));
                }
                yield decimal.setScale(0, RoundingMode.UNNECESSARY);
            }
        };

        if (integral.compareTo(MIN_THRESHOLD) < 0 || integral.compareTo(MAX_THRESHOLD) > 0) {
            throw new StructuralCompileException("Threshold '" + threshold + "' on " + variable
                    + " is outside the model's integer range");
        }
        return integral.intValueExact();
    }

    /** Flattens nested parameter elements to leafName → text. */
    private void collectParameters(Element el, Map<String, String> out) {
        List<Element> children = childElements(el);
        if (children.isEmpty()) {
            out.put(localName(el), el.getTextContent().trim());
            return;
        }
        for (Element child : children) {
            collectParameters(child, out);
        }
    }

    // =========================================================================
    // DOM helpers
    // =========================================================================

    private Document readDocument(String xml) throws SchemaViolationException {
        if (xml == null || xml.isBlank()) {
            throw new SchemaViolationException("Mission document is empty");
        }
        try {
            DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
            f.setNamespaceAware(true);
            f.setIgnoringComments(true);
            f.setCoalescing(true);
            f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);

            DocumentBuilder b = f.newDocumentBuilder();
            return b.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException | IOException e) {
            throw new SchemaViolationException("Mission is not well-formed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        }
    }

    private Element findFirst(Element el, String name) {
        if (name.equals(localName(el))) return el;
        for (Element child : childElements(el)) {
            Element found = findFirst(child, name);
            if (found != null) return found;
        }
        return null;
    }

    private Element child(Element el, String name) {
        for (Element child : childElements(el)) {
            if (name.equals(localName(child))) return child;
        }
        return null;
    }

    private List<Element> childElements(Element el) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = el.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n instanceof Element) out.add((Element) n);
        }
        return out;
    }

    private String requireAttribute(Element el, String name) throws StructuralCompileException {
        String value = el.getAttribute(name);
        if (value == null || value.isBlank()) {
            throw new StructuralCompileException("<" + localName(el) + "> is missing attribute '" + name + "'");
        }
        return value;
    }

    private static String localName(Element el) {
        return el.getLocalName() != null ? el.getLocalName() : el.getTagName();
    }
}
