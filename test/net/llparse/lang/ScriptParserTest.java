package net.llparse.lang;

import java.util.Arrays;
import java.util.Collections;
import junit.framework.TestCase;
import net.llparse.api.parser.ParserException;
import net.llparse.api.parser.ParsingException;
import net.llparse.ast.AssignmentExpr;
import net.llparse.ast.BinaryExpr;
import net.llparse.ast.CallExpr;
import net.llparse.ast.Expr;
import net.llparse.ast.ExpressionStatement;
import net.llparse.ast.Identifier;
import net.llparse.ast.NumericLiteral;
import net.llparse.ast.Program;
import net.llparse.ast.Stmt;
import net.llparse.util.config.Configuration;
import net.llparse.util.parser.ParserSettings;

public class ScriptParserTest extends TestCase {

    private ScriptParser parser;

    protected void setUp() throws Exception {
        parser = new ScriptParser(new ParserSettings(Configuration.NULL));
    }

    private static Program program(Stmt... body) {
        return new Program(Arrays.asList(body));
    }

    private static Stmt exprStmt(Expr e) {
        return new ExpressionStatement(e);
    }

    public void testCallWithBinaryArgument() throws Exception {
        Program p = parser.parse(Lex.tokens("print ( 5 + 10 ) ;"));
        Program expected = program(exprStmt(new CallExpr(
            new Identifier("print"),
            Collections.singletonList(new BinaryExpr(
                new NumericLiteral(5), "+", new NumericLiteral(10))))));
        assertEquals(expected, p);
    }

    public void testIndependentParses() throws Exception {
        Program first = parser.parse(Lex.tokens("x = 1 ;"));
        Program second = parser.parse(Lex.tokens("x = 2 ;"));
        assertEquals(program(exprStmt(new AssignmentExpr(
            new Identifier("x"), new NumericLiteral(1)))), first);
        assertEquals(program(exprStmt(new AssignmentExpr(
            new Identifier("x"), new NumericLiteral(2)))), second);
    }

    public void testIncompleteExpression() throws Exception {
        try {
            parser.parse(Lex.tokens("( 1 + ;"));
            fail("Incomplete expression accepted");
        } catch (ParsingException exc) {
            assertEquals(3, exc.getPosition());
            assertTrue(exc.getMessage(),
                       exc.getMessage().contains("(MultExpr, ;)"));
        }
        // The failure does not affect later parses.
        assertEquals(1, parser.parse(Lex.tokens("( 1 + 2 ) ;"))
                              .getBody().size());
    }

    public void testUnknownOperator() throws Exception {
        try {
            parser.parse(Lex.tokens("x ^ y ;"));
            fail("Unknown operator accepted");
        } catch (ParsingException exc) {
            assertEquals(1, exc.getPosition());
            assertTrue(exc.getMessage(),
                       exc.getMessage().startsWith("Unknown terminal ^"));
        }
    }

    public void testFailuresAreParserExceptions() {
        try {
            parser.parse(Lex.tokens("let ;"));
            fail("Invalid declaration accepted");
        } catch (ParserException exc) {
            assertTrue(exc instanceof ParsingException);
        }
    }

    public void testEmptyProgram() throws Exception {
        assertEquals(program(), parser.parse(Lex.tokens("")));
    }

    public void testDefaultInstanceIsShared() throws Exception {
        assertSame(ScriptParser.getDefault(), ScriptParser.getDefault());
        assertTrue(ScriptParser.getDefault().getAnalysis().isLL1());
        assertEquals(program(exprStmt(new Identifier("x"))),
                     ScriptParser.parseProgram(Lex.tokens("x ;")));
    }

    public void testParseTree() throws Exception {
        assertEquals("Program",
                     parser.parseTree(Lex.tokens("x ;")).getName());
    }

}
