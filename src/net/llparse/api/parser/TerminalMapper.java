package net.llparse.api.parser;

/**
 * The bridge between the lexical layer and a grammar.
 * A TerminalMapper is a pure, total function assigning every token the name
 * of the grammar terminal it stands for. Additionally, it tells whether a
 * token is an operator, such that a grammar's generic operator terminal (if
 * there is one) can match it regardless of the token's literal text.
 */
public interface TerminalMapper {

    /**
     * The name of the grammar terminal corresponding to the given token.
     * The end-of-input token must be mapped to the grammar's end marker.
     */
    String terminalFor(Token tok);

    /**
     * Whether the given token belongs to the operator token class.
     */
    boolean isOperator(Token tok);

}
