package net.llparse.util.parser;

import java.util.List;
import junit.framework.TestCase;
import net.llparse.api.parser.InvalidGrammarException;

public class GrammarTest extends TestCase {

    public void testValidGrammarHasNoIssues() throws Exception {
        Grammar g = Grammars.expressions();
        assertTrue(g.check().isEmpty());
        g.validate();
    }

    public void testEndMarkerIsAlwaysATerminal() {
        Grammar g = new Grammar();
        assertTrue(g.isTerminal(Terminal.END_MARKER));
        assertSame(Terminal.END_MARKER, g.getTerminal("$"));
    }

    public void testProductionIDsAreSequential() {
        Grammar g = Grammars.expressions();
        List<Production> prods = g.getProductions();
        for (int i = 0; i < prods.size(); i++) {
            assertEquals(i + 1, prods.get(i).getID());
        }
        assertEquals("E'", g.getProduction(3).getLHS().getName());
        assertTrue(g.getProduction(3).isEpsilon());
        assertNull(g.getProduction(42));
    }

    public void testProductionsOfNonterminal() {
        Grammar g = Grammars.expressions();
        List<Production> fs = g.getProductions(g.getNonterminal("F"));
        assertEquals(2, fs.size());
        assertEquals(7, fs.get(0).getID());
        assertEquals(8, fs.get(1).getID());
    }

    public void testUndefinedSymbol() {
        Grammar g = Grammars.repetition();
        g.addProduction("S", "b");
        List<String> issues = g.check();
        assertEquals(1, issues.size());
        assertTrue(issues.get(0), issues.get(0).contains("undefined"));
        assertTrue(issues.get(0), issues.get(0).contains("b"));
    }

    public void testMissingStartSymbol() {
        Grammar g = new Grammar();
        g.addNonterminal("S");
        g.addProduction("S");
        assertEquals(1, g.check().size());
        g.setStartSymbol("T");
        assertTrue(g.check().get(0).contains("not a nonterminal"));
    }

    public void testOverlappingSymbolSets() {
        Grammar g = Grammars.repetition();
        g.addNonterminal("a");
        assertTrue(g.check().get(0).contains("both a terminal and"));
    }

    public void testEpsilonMixedWithOtherSymbols() {
        Grammar g = Grammars.repetition();
        g.addProduction("S", "a", "ε");
        List<String> issues = g.check();
        assertEquals(1, issues.size());
        assertTrue(issues.get(0).contains("mixed"));
    }

    public void testDuplicateIDsAndUndeclaredLHS() {
        Grammar g = Grammars.repetition();
        g.addProduction(new Production(1, new Nonterminal("X"),
                                       Terminal.EPSILON));
        List<String> issues = g.check();
        assertEquals(2, issues.size());
        assertTrue(issues.get(0).contains("Duplicate production ID 1"));
        assertTrue(issues.get(1).contains("left-hand side X"));
    }

    public void testValidateReportsAllIssues() {
        Grammar g = Grammars.repetition();
        g.addProduction("S", "b");
        g.addProduction("Q", "a");
        try {
            g.validate();
            fail("Invalid grammar accepted");
        } catch (InvalidGrammarException exc) {
            assertEquals(2, exc.getIssues().size());
            assertTrue(exc.getMessage().startsWith("Invalid grammar (2"));
        }
    }

    public void testSnapshotIsFrozen() {
        Grammar g = Grammars.repetition();
        Grammar s = g.snapshot();
        assertTrue(s.isFrozen());
        assertSame(s, s.snapshot());
        try {
            s.addTerminal("b");
            fail("Frozen grammar modified");
        } catch (IllegalStateException exc) {
            // expected
        }
        g.addTerminal("b");
        assertNull(s.getTerminal("b"));
    }

}
