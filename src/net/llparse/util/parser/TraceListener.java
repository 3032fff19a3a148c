package net.llparse.util.parser;

import java.util.List;
import net.llparse.api.parser.ParsingException;
import net.llparse.api.parser.Token;

/**
 * An observer of the steps a PredictiveParser takes.
 * Listeners are invoked synchronously from within parse(); they must not
 * retain the stack lists they are handed, as those are live views.
 */
public interface TraceListener {

    /**
     * A listener that ignores everything.
     */
    TraceListener NULL = new TraceAdapter();

    /**
     * Invoked at the beginning of every iteration of the parsing loop.
     * stack holds the symbol stack (with the top last), lookahead is the
     * current token, terminal is the grammar terminal it maps to, and
     * position is the index of the token.
     */
    void step(List<Symbol> stack, Token lookahead, Terminal terminal,
              int position);

    /**
     * Invoked when the nonterminal on top of the stack is replaced by the
     * right-hand side of prod.
     */
    void expand(Production prod, int position);

    /**
     * Invoked when a terminal has been matched against a token.
     */
    void match(Terminal terminal, Token token, int position);

    /**
     * Invoked when the input has been accepted.
     */
    void accept(int position);

    /**
     * Invoked when parsing fails, before the exception propagates to the
     * caller.
     */
    void reject(ParsingException exc);

}
