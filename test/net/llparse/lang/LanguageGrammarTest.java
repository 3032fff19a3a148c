package net.llparse.lang;

import junit.framework.TestCase;
import net.llparse.util.parser.Analyzer;
import net.llparse.util.parser.Grammar;
import net.llparse.util.parser.GrammarAnalysis;

public class LanguageGrammarTest extends TestCase {

    public void testGrammarIsValid() {
        Grammar g = LanguageGrammar.create();
        assertEquals("[]", g.check().toString());
        assertEquals(LanguageGrammar.START, g.getStartSymbol().getName());
    }

    public void testGrammarIsLL1() throws Exception {
        GrammarAnalysis a = Analyzer.analyze(LanguageGrammar.create());
        assertEquals("[]", a.getConflicts().toString());
        assertTrue(a.isLL1());
    }

    public void testEveryTokenTypeHasATerminal() {
        Grammar g = LanguageGrammar.create();
        for (TokenType t : TokenType.values()) {
            if (t.getTerminal() == null) continue;
            assertNotNull(t.name(), g.getTerminal(t.getTerminal()));
        }
    }

    public void testOperatorTerminals() {
        LanguageTerminals m = LanguageTerminals.INSTANCE;
        assertEquals("addop", m.terminalFor(Lex.token("-")));
        assertEquals("mulop", m.terminalFor(Lex.token("%")));
        assertEquals("relop", m.terminalFor(Lex.token("<=")));
        assertEquals("unop", m.terminalFor(Lex.token("!")));
        assertEquals("=", m.terminalFor(Lex.token("=")));
        assertEquals("$", m.terminalFor(LanguageToken.eof()));
        assertTrue(m.isOperator(Lex.token("+")));
        assertFalse(m.isOperator(Lex.token("=")));
    }

}
