package net.llparse.lang;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import net.llparse.api.parser.TerminalMapper;
import net.llparse.api.parser.Token;

public class LanguageTerminals implements TerminalMapper {

    public static final String T_ADDOP = "addop";
    public static final String T_MULOP = "mulop";
    public static final String T_RELOP = "relop";
    public static final String T_UNOP = "unop";

    public static final Set<String> ADD_OPERATORS = set("+", "-");
    public static final Set<String> MUL_OPERATORS = set("*", "/", "%");
    public static final Set<String> REL_OPERATORS = set("<", ">", "<=",
                                                        ">=", "==", "!=");
    public static final Set<String> UNARY_OPERATORS = set("!");

    public static final LanguageTerminals INSTANCE = new LanguageTerminals();

    protected TokenType typeOf(Token tok) {
        if (tok instanceof LanguageToken)
            return ((LanguageToken) tok).getType();
        for (TokenType t : TokenType.values()) {
            if (t.name().equals(tok.getName())) return t;
        }
        return null;
    }

    /* Unknown token types and operators are mapped to names that are not
     * terminals of the language grammar, so that the parser rejects
     * them. */
    public String terminalFor(Token tok) {
        TokenType type = typeOf(tok);
        if (type == null) return tok.getName();
        if (type != TokenType.BINARY_OPERATOR) return type.getTerminal();
        String op = tok.getContent();
        if (ADD_OPERATORS.contains(op)) return T_ADDOP;
        if (MUL_OPERATORS.contains(op)) return T_MULOP;
        if (REL_OPERATORS.contains(op)) return T_RELOP;
        if (UNARY_OPERATORS.contains(op)) return T_UNOP;
        return op;
    }

    public boolean isOperator(Token tok) {
        return (typeOf(tok) == TokenType.BINARY_OPERATOR);
    }

    private static Set<String> set(String... items) {
        return Collections.unmodifiableSet(
            new HashSet<String>(Arrays.asList(items)));
    }

}
