package com.missionforge.core.compiler;

import com.missionforge.core.error.StructuralCompileException;
import com.missionforge.core.tree.BehaviorNode;
import com.missionforge.core.tree.Comparator;
import com.missionforge.core.tree.TaskNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelCompilerTest {

    private ModelCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new ModelCompiler(PromelaTemplate.of("mtype = { move };"));
    }

    private BehaviorNode temperatureMission() {
        return BehaviorNode.sequence(
                BehaviorNode.leaf("T1", "move"),
                BehaviorNode.fallback(
                        BehaviorNode.valueCondition("temp", Comparator.GT, 30),
                        BehaviorNode.leaf("T2", "moveAlt"),
                        BehaviorNode.leaf("T3", "moveEnd")
                )
        );
    }

    @Test
    void testSequenceWithGatedFallback() throws Exception {
        CompiledProgram program = compiler.compile(temperatureMission());

        assertEquals(List.of("T1", "T2", "T3"), program.getTaskNames());
        assertEquals(List.of("Task T1;", "Task T2;", "Task T3;"), program.getTaskDeclarations());
        assertEquals(List.of("temp"), program.getGlobalNames());
        assertTrue(program.getGlobalDeclarations().contains("int temp;"));
        assertEquals(1, program.getSensorSelectors().size());

        String expectedInit =
                "        T1.action.actionType = move;\n"
              + "        select_temp(29, 31);\n"
              + "        if\n"
              + "        :: temp > 30 ->\n"
              + "            T2.action.actionType = moveAlt;\n"
              + "        :: else ->\n"
              + "            T3.action.actionType = moveEnd;\n"
              + "        fi;\n";
        assertEquals(expectedInit, program.getInitBlock());
    }

    @Test
    void testRenderOrder() throws Exception {
        String text = compiler.compile(temperatureMission()).render();

        int preamble  = text.indexOf("mtype = { move };");
        int task      = text.indexOf("Task T1;");
        int global    = text.indexOf("int temp;");
        int selector  = text.indexOf("inline select_temp(lo, hi) {");
        int init      = text.indexOf("init {");

        assertTrue(preamble >= 0 && preamble < task);
        assertTrue(task < global);
        assertTrue(global < selector);
        assertTrue(selector < init);
        assertTrue(text.contains("    select(temp : lo .. hi);"));
        assertTrue(text.endsWith("    atomic {\n" + compiler.compile(temperatureMission()).getInitBlock() + "    }\n}\n"));
    }

    @Test
    void testCompileIsIdempotent() throws Exception {
        String first  = compiler.compile(temperatureMission()).render();
        String second = compiler.compile(temperatureMission()).render();

        assertEquals(first, second);
    }

    @Test
    void testGlobalDeclaredOnceForRepeatedVariable() throws Exception {
        BehaviorNode tree = BehaviorNode.sequence(
                BehaviorNode.fallback(
                        BehaviorNode.valueCondition("temp", Comparator.GT, 30),
                        BehaviorNode.leaf("A", "move"),
                        BehaviorNode.leaf("B", "move")
                ),
                BehaviorNode.fallback(
                        BehaviorNode.valueCondition("temp", Comparator.LT, 10),
                        BehaviorNode.leaf("C", "move"),
                        BehaviorNode.leaf("D", "move")
                )
        );

        CompiledProgram program = compiler.compile(tree);
        String text = program.render();

        assertEquals(1, program.getGlobalDeclarations().size());
        assertEquals(text.indexOf("int temp;"), text.lastIndexOf("int temp;"));
        assertEquals(text.indexOf("inline select_temp"), text.lastIndexOf("inline select_temp"));
        assertTrue(text.contains("select_temp(29, 31);"));
        assertTrue(text.contains("select_temp(9, 11);"));
    }

    @Test
    void testThresholdsOfOneChoiceShareOneSelection() throws Exception {
        BehaviorNode tree = BehaviorNode.fallback(
                BehaviorNode.valueCondition("co2", Comparator.GT, 50),
                BehaviorNode.leaf("High", "move"),
                BehaviorNode.valueCondition("co2", Comparator.LT, 20),
                BehaviorNode.leaf("Low", "move")
        );

        String init = compiler.compile(tree).getInitBlock();

        assertTrue(init.contains("select_co2(19, 51);"));
        assertEquals(init.indexOf("select_co2"), init.lastIndexOf("select_co2"));
    }

    @Test
    void testAllGatedFallbackGetsSkipElse() throws Exception {
        BehaviorNode tree = BehaviorNode.fallback(
                BehaviorNode.boolCondition("obstacle", true),
                BehaviorNode.leaf("Avoid", "move")
        );

        String init = compiler.compile(tree).getInitBlock();

        assertTrue(init.contains(":: obstacle == 1 ->"));
        assertTrue(init.contains(":: else -> skip"));
    }

    @Test
    void testOnlyOneElseBranch() throws Exception {
        BehaviorNode tree = BehaviorNode.fallback(
                BehaviorNode.valueCondition("temp", Comparator.GTE, 30),
                BehaviorNode.leaf("Hot", "move"),
                BehaviorNode.leaf("Other", "move"),
                BehaviorNode.leaf("Unreachable", "move")
        );

        CompiledProgram program = compiler.compile(tree);
        String init = program.getInitBlock();

        assertEquals(init.indexOf(":: else"), init.lastIndexOf(":: else"));
        assertFalse(program.getTaskNames().contains("Unreachable"));
    }

    @Test
    void testConditionInsideSequenceIsOneBranchChoice() throws Exception {
        BehaviorNode tree = BehaviorNode.sequence(
                BehaviorNode.boolCondition("ready", false),
                BehaviorNode.leaf("Go", "move")
        );

        String init = compiler.compile(tree).getInitBlock();

        assertTrue(init.contains("select_ready(0, 1);"));
        assertTrue(init.contains(":: ready == 0 ->"));
        assertTrue(init.contains(":: else -> skip"));
    }

    @Test
    void testFallbackBranchLedBySequenceCondition() throws Exception {
        BehaviorNode tree = BehaviorNode.fallback(
                BehaviorNode.sequence(
                        BehaviorNode.valueCondition("temp", Comparator.GT, 30),
                        BehaviorNode.leaf("Picture", "takeThermalPicture"),
                        BehaviorNode.leaf("Leave", "move")
                ),
                BehaviorNode.leaf("Home", "move")
        );

        String init = compiler.compile(tree).getInitBlock();

        int guard   = init.indexOf(":: temp > 30 ->");
        int picture = init.indexOf("Picture.action.actionType");
        int leave   = init.indexOf("Leave.action.actionType");
        int other   = init.indexOf(":: else ->");
        assertTrue(guard >= 0 && guard < picture && picture < leave && leave < other);
    }

    @Test
    void testParallelIsSkipped() throws Exception {
        BehaviorNode tree = BehaviorNode.sequence(
                BehaviorNode.leaf("T1", "move"),
                BehaviorNode.parallel(List.of(BehaviorNode.leaf("T2", "move")))
        );

        CompiledProgram program = compiler.compile(tree);

        assertEquals(List.of("T1"), program.getTaskNames());
        assertFalse(program.getInitBlock().contains("T2"));
    }

    @Test
    void testTrailingConditionIsStructuralError() {
        BehaviorNode tree = BehaviorNode.sequence(
                BehaviorNode.leaf("T1", "move"),
                BehaviorNode.boolCondition("done", true)
        );

        assertThrows(StructuralCompileException.class, () -> compiler.compile(tree));
    }

    @Test
    void testConsecutiveConditionsAreStructuralError() {
        BehaviorNode tree = BehaviorNode.fallback(
                BehaviorNode.boolCondition("a", true),
                BehaviorNode.boolCondition("b", true),
                BehaviorNode.leaf("T1", "move")
        );

        assertThrows(StructuralCompileException.class, () -> compiler.compile(tree));
    }

    @Test
    void testMalformedNodesAreStructuralErrors() {
        assertThrows(StructuralCompileException.class, () -> compiler.compile(null));
        assertThrows(StructuralCompileException.class,
                () -> compiler.compile(BehaviorNode.leaf("1bad", "move")));
        assertThrows(StructuralCompileException.class,
                () -> compiler.compile(BehaviorNode.fallback(List.of())));
        assertThrows(StructuralCompileException.class,
                () -> compiler.compile(BehaviorNode.valueCondition("temp", null, 3)));
    }

    @Test
    void testTaskParametersFillActionFields() throws Exception {
        Map<String, String> coordinates = new LinkedHashMap<>();
        coordinates.put("Latitude", "37.266123");
        coordinates.put("Longitude", "-120.42011");
        coordinates.put("Altitude", "12");

        BehaviorNode tree = BehaviorNode.sequence(
                BehaviorNode.leaf(new TaskNode("Go", "moveToLocation", coordinates)),
                BehaviorNode.leaf(new TaskNode("Sample", "takeCO2Reading", Map.of("numberOfSamples", "3")))
        );

        String expectedInit =
                "        Go.action.actionType = moveToLocation;\n"
              + "        Go.action.parameter1 = 3726612;\n"
              + "        Go.action.parameter2 = -12042011;\n"
              + "        Sample.action.actionType = takeCO2Reading;\n"
              + "        Sample.action.parameter1 = 3;\n";
        assertEquals(expectedInit, compiler.compile(tree).getInitBlock());
    }

    @Test
    void testNonNumericParameterIsStructuralError() {
        BehaviorNode tree = BehaviorNode.leaf(
                new TaskNode("Sample", "takeAmbientTemperature", Map.of("numberOfSamples", "three")));

        assertThrows(StructuralCompileException.class, () -> compiler.compile(tree));
    }
}
