package com.missionforge.core.automaton;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PropertyTextTest {

    @Test
    void testStripsLtlLabel() {
        assertEquals("<>(a && <>b)", PropertyText.stripLabel("ltl mission {\n  <>(a && <>b)\n}"));
        assertEquals("<>(a && <>b)", PropertyText.stripLabel("ltl { <>(a && <>b) }"));
        assertEquals("<>a", PropertyText.stripLabel("  <>a  "));
    }

    @Test
    void testQuotesRelationalAtoms() {
        String formula = "[](temp > 30 -> <> T1.action.actionType == moveToLocation)";

        assertEquals("[](\"temp > 30\" -> <> \"T1.action.actionType == moveToLocation\")",
                PropertyText.quoteAtoms(formula));
    }

    @Test
    void testNormalisesSpacingInsideAtoms() {
        assertEquals("<>(\"co2 <= -5\")", PropertyText.quoteAtoms("<>(co2<=-5)"));
    }

    @Test
    void testLeavesQuotedTextAlone() {
        String formula = "<>(\"temp > 30\" && humidity != 2)";

        assertEquals("<>(\"temp > 30\" && \"humidity != 2\")", PropertyText.quoteAtoms(formula));
    }

    @Test
    void testQuotedAtomsAreDistinctAndOrdered() {
        List<String> atoms = PropertyText.quotedAtoms("\"b == 1\" U (\"a == 1\" && \"b == 1\")");

        assertEquals(List.of("\"b == 1\"", "\"a == 1\""), atoms);
    }

    @Test
    void testInitiallyFalsePrefix() {
        String formula = PropertyText.toTranslatorFormula("ltl m { <>(x == 1 && <> y == 1) }", true);

        assertEquals("!\"x == 1\" && !\"y == 1\" && (<>(\"x == 1\" && <> \"y == 1\"))", formula);
    }

    @Test
    void testWithoutInitiallyFalsePrefix() {
        assertEquals("<>(\"x == 1\")", PropertyText.toTranslatorFormula("ltl m { <>(x == 1) }", false));
        assertEquals("<>p", PropertyText.toTranslatorFormula("<>p", true));
    }
}
