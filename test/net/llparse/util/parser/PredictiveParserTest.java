package net.llparse.util.parser;

import java.util.ArrayList;
import java.util.List;
import junit.framework.TestCase;
import net.llparse.api.parser.InvalidGrammarException;
import net.llparse.api.parser.Parser;
import net.llparse.api.parser.ParsingException;
import net.llparse.api.parser.Token;

public class PredictiveParserTest extends TestCase {

    private static class RecordingListener extends TraceAdapter {

        final List<String> events = new ArrayList<String>();
        final List<Integer> stackSizes = new ArrayList<Integer>();

        public void step(List<Symbol> stack, Token lookahead,
                         Terminal terminal, int position) {
            stackSizes.add(stack.size());
        }

        public void expand(Production prod, int position) {
            events.add("expand " + prod.getID() + "@" + position);
        }

        public void match(Terminal terminal, Token token, int position) {
            events.add("match " + terminal + "@" + position);
        }

        public void accept(int position) {
            events.add("accept@" + position);
        }

        public void reject(ParsingException exc) {
            events.add("reject@" + exc.getPosition());
        }

    }

    private static Parser.ParseTree parse(Grammar g, String input)
            throws Exception {
        return PredictiveParser.compile(g, SimpleTokens.MAPPER)
            .parse(SimpleTokens.tokens(input));
    }

    private static ParsingException parseError(Grammar g, String input)
            throws Exception {
        PredictiveParser p = PredictiveParser.compile(g,
                                                      SimpleTokens.MAPPER);
        try {
            p.parse(SimpleTokens.tokens(input));
        } catch (ParsingException exc) {
            return exc;
        }
        fail("Input accepted: " + input);
        return null;
    }

    public void testRepetition() throws Exception {
        Parser.ParseTree root = parse(Grammars.repetition(), "a a $");
        assertEquals("S", root.getName());
        assertFalse(root.isTerminal());
        assertEquals(2, root.getChildren().size());
        Parser.ParseTree a = root.getChildren().get(0);
        assertTrue(a.isTerminal());
        assertEquals("a", a.getToken().getContent());
        Parser.ParseTree inner = root.getChildren().get(1);
        assertEquals("S", inner.getName());
        assertEquals(2, inner.getChildren().size());
        Parser.ParseTree last = inner.getChildren().get(1);
        assertEquals("S", last.getName());
        assertTrue(last.getChildren().isEmpty());
        assertEquals("S(a<a> S(a<a> S))", root.toString());
    }

    public void testEmptyInput() throws Exception {
        Parser.ParseTree root = parse(Grammars.repetition(), "$");
        assertTrue(root.getChildren().isEmpty());
    }

    public void testExpressions() throws Exception {
        Parser.ParseTree root = parse(Grammars.expressions(),
                                      "id + ( id * id ) $");
        assertEquals("E(T(F(id<id>) T') E'(+<+> T(F((<(> " +
            "E(T(F(id<id>) T'(*<*> F(id<id>) T')) E') )<)>) T') E'))",
            root.toString());
    }

    public void testTrailingInput() throws Exception {
        ParsingException exc = parseError(Grammars.expressions(),
                                          "id ) $");
        assertEquals(1, exc.getPosition());
        assertTrue(exc.getMessage(),
                   exc.getMessage().startsWith("Unexpected trailing input"));
    }

    public void testTerminalMismatch() throws Exception {
        ParsingException exc = parseError(Grammars.expressions(),
                                          "( id id $");
        assertEquals(2, exc.getPosition());
        assertTrue(exc.getMessage(),
                   exc.getMessage().contains("No production for (T', id)"));
        Grammar g = new Grammar();
        g.addTerminals("x", "y");
        g.addNonterminal("S");
        g.setStartSymbol("S");
        g.addProduction("S", "x", "y");
        exc = parseError(g, "x x $");
        assertEquals(1, exc.getPosition());
        assertEquals("Expected y, found x 'x' at position 1",
                     exc.getMessage());
        exc = parseError(g, "x $");
        assertEquals(1, exc.getPosition());
        assertTrue(exc.getMessage(),
                   exc.getMessage().startsWith("Unexpected end of input"));
    }

    public void testPrematureEnd() throws Exception {
        ParsingException exc = parseError(Grammars.repetition(), "a a");
        assertEquals(2, exc.getPosition());
        assertTrue(exc.getMessage(),
                   exc.getMessage().startsWith("Premature end of input"));
    }

    public void testUnknownTerminal() throws Exception {
        ParsingException exc = parseError(Grammars.repetition(), "a b $");
        assertEquals(1, exc.getPosition());
        assertTrue(exc.getMessage(),
                   exc.getMessage().startsWith("Unknown terminal b"));
    }

    public void testOperatorClass() throws Exception {
        Parser.ParseTree root = parse(Grammars.operators(),
                                      "n + n - n $");
        assertEquals("E(n<n> R(op<+> n<n> R(op<-> n<n> R)))",
                     root.toString());
        // "*" is not a declared terminal but is still an operator.
        root = parse(Grammars.operators(), "n * n $");
        assertEquals("E(n<n> R(op<*> n<n> R))", root.toString());
        ParsingException exc = parseError(Grammars.operators(), "n n $");
        assertEquals(1, exc.getPosition());
        assertTrue(exc.getMessage(),
                   exc.getMessage().contains("No production for (R, n)"));
    }

    public void testOperatorClassWithoutOperatorTerminals()
            throws Exception {
        Grammar g = new Grammar();
        g.addTerminal("n");
        g.setOperatorClass("op");
        g.addNonterminals("E", "R");
        g.setStartSymbol("E");
        g.addProduction("E", "n", "R");
        g.addProduction("R", "op", "n", "R");
        g.addProduction("R");
        Parser.ParseTree root = parse(g, "n * n / n $");
        assertEquals("E(n<n> R(op<*> n<n> R(op</> n<n> R)))",
                     root.toString());
        assertEquals("*", root.getChildren().get(1).getChildren().get(0)
                              .getToken().getContent());
        ParsingException exc = parseError(g, "n x n $");
        assertEquals(1, exc.getPosition());
        assertTrue(exc.getMessage(),
                   exc.getMessage().startsWith("Unknown terminal x"));
    }

    public void testOperatorWithoutOperatorClassIsUnknown()
            throws Exception {
        ParsingException exc = parseError(Grammars.repetition(), "a * $");
        assertEquals(1, exc.getPosition());
        assertTrue(exc.getMessage(),
                   exc.getMessage().startsWith("Unknown terminal *"));
    }

    public void testInputAfterEndMarker() throws Exception {
        RecordingListener l = new RecordingListener();
        PredictiveParser p = PredictiveParser.compile(Grammars.repetition(),
            SimpleTokens.MAPPER, l);
        try {
            p.parse(SimpleTokens.tokens("a $ a $"));
            fail("Input after end marker accepted");
        } catch (ParsingException exc) {
            assertEquals(2, exc.getPosition());
            assertEquals("Unexpected trailing input at position 2 after " +
                         "end of input: 'a'", exc.getMessage());
        }
        assertEquals("[expand 1@0, match a@0, expand 2@1, reject@2]",
                     l.events.toString());
    }

    public void testParserIsReusable() throws Exception {
        PredictiveParser p = PredictiveParser.compile(Grammars.repetition(),
            SimpleTokens.MAPPER);
        try {
            p.parse(SimpleTokens.tokens("a b $"));
            fail("Invalid input accepted");
        } catch (ParsingException exc) {
            // expected
        }
        Parser.ParseTree first = p.parse(SimpleTokens.tokens("a $"));
        Parser.ParseTree second = p.parse(SimpleTokens.tokens("a a $"));
        assertEquals("S(a<a> S)", first.toString());
        assertEquals("S(a<a> S(a<a> S))", second.toString());
    }

    public void testInvalidGrammarIsRejected() throws Exception {
        Grammar g = Grammars.repetition();
        g.addProduction("S", "b");
        try {
            PredictiveParser.compile(g, SimpleTokens.MAPPER);
            fail("Invalid grammar compiled");
        } catch (InvalidGrammarException exc) {
            assertEquals(1, exc.getIssues().size());
        }
    }

    public void testTracing() throws Exception {
        RecordingListener l = new RecordingListener();
        PredictiveParser p = PredictiveParser.compile(Grammars.repetition(),
            SimpleTokens.MAPPER, l);
        p.parse(SimpleTokens.tokens("a $"));
        assertEquals("[expand 1@0, match a@0, expand 2@1, accept@1]",
                     l.events.toString());
        assertEquals("[2, 3, 2, 1]", l.stackSizes.toString());
        l.events.clear();
        try {
            p.parse(SimpleTokens.tokens("b $"));
            fail("Invalid input accepted");
        } catch (ParsingException exc) {
            // expected
        }
        assertEquals("[reject@0]", l.events.toString());
    }

    public void testLoggingTraceListener() throws Exception {
        LoggingTraceListener l = new LoggingTraceListener("LLTraceTest");
        assertEquals("LLTraceTest", l.getLogger().getName());
        PredictiveParser p = PredictiveParser.compile(Grammars.expressions(),
            SimpleTokens.MAPPER, l);
        assertEquals("E(T(F(id<id>) T') E')",
                     p.parse(SimpleTokens.tokens("id $")).toString());
    }

}
