package net.llparse.util.parser;

import java.util.logging.Logger;
import net.llparse.api.parser.InvalidGrammarException;

public final class Analyzer {

    private static final Logger LOGGER = Logger.getLogger("Analyzer");

    private Analyzer() {}

    /* Validate the grammar and derive its FIRST sets, FOLLOW sets, and
     * parse table. The grammar is snapshotted, so that later changes to
     * it do not affect the result. */
    public static GrammarAnalysis analyze(Grammar grammar)
            throws InvalidGrammarException {
        if (grammar == null)
            throw new NullPointerException("Grammar may not be null");
        grammar.validate();
        Grammar g = grammar.snapshot();
        FirstSets first = SetSolver.computeFirst(g);
        FollowSets follow = SetSolver.computeFollow(g, first);
        ParseTable table = TableBuilder.build(g, first, follow);
        LOGGER.fine("Analyzed grammar with " + g.getProductions().size() +
            " productions; " + table.getConflicts().size() +
            " conflict(s)");
        return new GrammarAnalysis(g, first, follow, table);
    }

}
