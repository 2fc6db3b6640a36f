package com.missionforge.core.tree;

import com.missionforge.core.error.SchemaViolationException;
import com.missionforge.core.error.StructuralCompileException;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MissionParserTest {

    private final MissionParser parser = new MissionParser();

    private static String mission(String body) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<Mission xmlns=\"https://robotics.ucmerced.edu/task\">\n"
                + "  <CompositeTaskInformation><TaskID>M</TaskID></CompositeTaskInformation>\n"
                + "  <ActionSequence>\n" + body + "\n  </ActionSequence>\n"
                + "</Mission>";
    }

    private static String task(String id, String type) {
        return "<AtomicTask><TaskID>" + id + "</TaskID><Action><ActionType>" + type
                + "</ActionType></Action></AtomicTask>";
    }

    private BehaviorNode.ValueCondition valueCondition(String comparator, String threshold) throws Exception {
        BehaviorNode root = parser.parse(mission(
                "<Sequence><ValueCondition variable=\"temp\" comparator=\"" + comparator
                + "\" threshold=\"" + threshold + "\"/>" + task("Go", "moveToLocation") + "</Sequence>"));
        return (BehaviorNode.ValueCondition) root.getChildren().get(0);
    }

    @Test
    void testParsesSequenceAndFallback() throws Exception {
        BehaviorNode root = parser.parse(mission(
                "<Sequence>"
                + task("T1", "moveToLocation")
                + "<Fallback>"
                + "<ValueCondition variable=\"temp\" comparator=\"gt\" threshold=\"30\"/>"
                + task("T2", "moveToLocation")
                + task("T3", "moveToLocation")
                + "</Fallback>"
                + "</Sequence>"));

        assertEquals(BehaviorNode.Kind.SEQUENCE, root.getKind());
        assertEquals(2, root.getChildren().size());

        BehaviorNode fallback = root.getChildren().get(1);
        assertEquals(BehaviorNode.Kind.FALLBACK, fallback.getKind());

        BehaviorNode.ValueCondition condition = (BehaviorNode.ValueCondition) fallback.getChildren().get(0);
        assertEquals("temp", condition.getVariable());
        assertEquals(Comparator.GT, condition.getComparator());
        assertEquals(30, condition.getThreshold());

        assertEquals("T1", ((BehaviorNode.Leaf) root.getChildren().get(0)).getTask().getId());
        assertEquals(List.of("ValueCondition(temp > 30)", "Leaf(T2)", "Leaf(T3)"),
                fallback.getChildren().stream().map(Object::toString).collect(Collectors.toList()));
        assertEquals(4, BehaviorTrees.countTasks(root));
    }

    @Test
    void testActionParametersAreFlattened() throws Exception {
        BehaviorNode root = parser.parse(mission(
                "<AtomicTask><TaskID>Go</TaskID><Action>"
                + "<ActionType>moveToLocation</ActionType>"
                + "<moveToLocation><Latitude>37.26</Latitude><Longitude>-120.42</Longitude></moveToLocation>"
                + "</Action></AtomicTask>"));

        TaskNode task = ((BehaviorNode.Leaf) root).getTask();
        assertEquals("moveToLocation", task.getActionType());
        assertEquals(Map.of("Latitude", "37.26", "Longitude", "-120.42"), task.getParameters());
    }

    @Test
    void testBooleanCondition() throws Exception {
        BehaviorNode root = parser.parse(mission(
                "<Sequence><BooleanCondition variable=\"obstacle\" expected=\"false\"/>"
                + task("Go", "moveToLocation") + "</Sequence>"));

        BehaviorNode.BoolCondition condition = (BehaviorNode.BoolCondition) root.getChildren().get(0);
        assertEquals("obstacle", condition.getVariable());
        assertFalse(condition.getExpected());
    }

    @Test
    void testBooleanConditionAcceptsNumericForm() throws Exception {
        BehaviorNode root = parser.parse(mission(
                "<Sequence><BooleanCondition variable=\"obstacle\" expected=\"1\"/>"
                + task("Go", "moveToLocation") + "</Sequence>"));

        assertTrue(((BehaviorNode.BoolCondition) root.getChildren().get(0)).getExpected());

        root = parser.parse(mission(
                "<Sequence><BooleanCondition variable=\"obstacle\" expected=\" 0 \"/>"
                + task("Go", "moveToLocation") + "</Sequence>"));

        assertFalse(((BehaviorNode.BoolCondition) root.getChildren().get(0)).getExpected());
    }

    @Test
    void testBooleanConditionRejectsOtherValues() {
        assertThrows(StructuralCompileException.class, () -> parser.parse(mission(
                "<Sequence><BooleanCondition variable=\"obstacle\" expected=\"yes\"/>"
                + task("Go", "moveToLocation") + "</Sequence>")));
    }

    @Test
    void testFractionalThresholdKeepsIntegerSolutions() throws Exception {
        assertEquals(30, valueCondition("gt", "30.5").getThreshold());
        assertEquals(41, valueCondition("lte", "41.6").getThreshold());
        assertEquals(31, valueCondition("lt", "30.5").getThreshold());
        assertEquals(-2, valueCondition("gte", "-2.5").getThreshold());
        assertEquals(-3, valueCondition("gt", "-2.5").getThreshold());
        assertEquals(30, valueCondition("eq", "30.00").getThreshold());
        assertEquals(Comparator.LTE, valueCondition("lte", "41.6").getComparator());
    }

    @Test
    void testFractionalEqualityIsStructuralError() {
        assertThrows(StructuralCompileException.class, () -> valueCondition("eq", "30.5"));
        assertThrows(StructuralCompileException.class, () -> valueCondition("neq", "0.1"));
    }

    @Test
    void testThresholdOutsideIntegerRangeIsStructuralError() {
        assertThrows(StructuralCompileException.class, () -> valueCondition("gt", "3000000000"));
        assertThrows(StructuralCompileException.class, () -> valueCondition("lt", "2147483647"));
        assertThrows(StructuralCompileException.class, () -> valueCondition("gt", "-2147483648"));
        assertDoesNotThrow(() -> valueCondition("gt", "2147483646"));
    }

    @Test
    void testParallelIsNotCounted() throws Exception {
        BehaviorNode root = parser.parse(mission(
                "<Sequence>" + task("A", "moveToLocation")
                + "<Parallel>" + task("B", "takeThermalPicture") + task("C", "takeCO2Reading") + "</Parallel>"
                + "</Sequence>"));

        assertEquals(BehaviorNode.Kind.PARALLEL, root.getChildren().get(1).getKind());
        assertEquals(1, BehaviorTrees.countTasks(root));
    }

    @Test
    void testUnknownElementIsStructuralError() {
        assertThrows(StructuralCompileException.class,
                () -> parser.parse(mission("<Loop>" + task("A", "moveToLocation") + "</Loop>")));
    }

    @Test
    void testUnknownComparatorIsStructuralError() {
        assertThrows(StructuralCompileException.class,
                () -> parser.parse(mission("<Sequence><ValueCondition variable=\"t\" comparator=\"about\" threshold=\"1\"/>"
                        + task("A", "moveToLocation") + "</Sequence>")));
    }

    @Test
    void testMalformedXmlIsSchemaViolation() {
        assertThrows(SchemaViolationException.class, () -> parser.parse("<Mission><ActionSequence>"));
        assertThrows(SchemaViolationException.class, () -> parser.parse("  "));
    }

    @Test
    void testMissingActionSequence() {
        assertThrows(StructuralCompileException.class,
                () -> parser.parse("<Mission xmlns=\"https://robotics.ucmerced.edu/task\"/>"));
    }
}
