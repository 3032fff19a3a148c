package net.llparse.api.parser;

import java.util.List;
import net.llparse.api.NamedValue;

/**
 * A grammar-driven parser.
 * A parser matches a token sequence against a grammar and produces a parse
 * tree, or rejects the input as not matching the grammar.
 * Implementations must be reusable: every parse() call starts from a fresh
 * state, and a failed parse does not affect later ones.
 */
public interface Parser {

    /**
     * A single parse tree node.
     * A parse tree has a name (that is the name of the grammar symbol the
     * node stands for), an optional token (present on terminal nodes), and
     * a list of child nodes. Children are exclusively owned by their parent.
     */
    interface ParseTree extends NamedValue {

        /**
         * Whether this node stands for a terminal symbol.
         */
        boolean isTerminal();

        /**
         * The token this ParseTree directly corresponds to, or null.
         * Only terminal nodes have tokens.
         */
        Token getToken();

        /**
         * An immutable list of this node's children.
         * Nodes for terminals, as well as nodes for nonterminals that have
         * been expanded into the empty derivation, have no children.
         */
        List<ParseTree> getChildren();

    }

    /**
     * Parse the given token sequence.
     * The sequence must be terminated by an end-of-input token. A
     * ParsingException is thrown if parsing fails for any reason.
     */
    ParseTree parse(List<? extends Token> tokens) throws ParsingException;

}
