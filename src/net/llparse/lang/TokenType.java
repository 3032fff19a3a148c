package net.llparse.lang;

/**
 * The token categories produced by the scripting language's lexer.
 */
public enum TokenType {

    NUMBER("number", false),
    STRING("string", false),
    IDENTIFIER("identifier", false),

    LET("let", true),
    CONST("const", true),
    FN("fn", true),
    IF("if", true),
    ELSE("else", true),
    WHILE("while", true),
    FOR("for", true),
    RETURN("return", true),
    BREAK("break", true),
    CONTINUE("continue", true),

    // The terminal depends on the operator text; see LanguageTerminals.
    BINARY_OPERATOR(null, false),
    EQUALS("=", true),
    COMMA(",", true),
    DOT(".", true),
    COLON(":", true),
    SEMICOLON(";", true),
    OPEN_PAREN("(", true),
    CLOSE_PAREN(")", true),
    OPEN_BRACE("{", true),
    CLOSE_BRACE("}", true),
    OPEN_BRACKET("[", true),
    CLOSE_BRACKET("]", true),

    EOF("$", false);

    private final String terminal;
    private final boolean fixed;

    private TokenType(String terminal, boolean fixed) {
        this.terminal = terminal;
        this.fixed = fixed;
    }

    /**
     * The grammar terminal tokens of this type map to, or null if that
     * depends on the token's text.
     */
    public String getTerminal() {
        return terminal;
    }

    /**
     * Whether all tokens of this type have the same text (namely, the
     * name of the terminal), as keywords and punctuation do.
     */
    public boolean isFixed() {
        return fixed;
    }

    /**
     * The fixed-text token type spelled as text, or null if there is none.
     */
    public static TokenType forText(String text) {
        for (TokenType t : values()) {
            if (t.fixed && t.terminal.equals(text)) return t;
        }
        return null;
    }

}
