package net.llparse.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

public class TableBuilder {

    private static final Logger LOGGER = Logger.getLogger("TableBuilder");

    private final Grammar grammar;
    private final FirstSets first;
    private final FollowSets follow;
    private final Map<Nonterminal, Map<Terminal, Production>> cells;
    private final List<ParseTable.Conflict> conflicts;

    public TableBuilder(Grammar grammar, FirstSets first,
                        FollowSets follow) {
        this.grammar = grammar;
        this.first = first;
        this.follow = follow;
        this.cells = new LinkedHashMap<Nonterminal,
                                       Map<Terminal, Production>>();
        this.conflicts = new ArrayList<ParseTable.Conflict>();
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public FirstSets getFirstSets() {
        return first;
    }

    public FollowSets getFollowSets() {
        return follow;
    }

    public List<ParseTable.Conflict> getConflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    protected void put(Nonterminal nt, Terminal t, Production p) {
        Map<Terminal, Production> row = cells.get(nt);
        if (row == null) {
            row = new LinkedHashMap<Terminal, Production>();
            cells.put(nt, row);
        }
        Production existing = row.get(t);
        if (existing == null) {
            row.put(t, p);
        } else if (! existing.equals(p)) {
            ParseTable.Conflict c = new ParseTable.Conflict(nt, t,
                                                            existing, p);
            LOGGER.warning("Parse table conflict at " + c);
            conflicts.add(c);
        }
    }

    protected void add(Production p) {
        Nonterminal lhs = p.getLHS();
        Set<Terminal> fs = SetSolver.firstOfSequence(p.getRHS(), first);
        for (Terminal t : fs) {
            if (! t.isEpsilon()) put(lhs, t, p);
        }
        if (fs.contains(Terminal.EPSILON)) {
            for (Terminal t : follow.get(lhs)) put(lhs, t, p);
        }
    }

    public ParseTable build() {
        cells.clear();
        conflicts.clear();
        for (Nonterminal nt : grammar.getNonterminals()) {
            cells.put(nt, new LinkedHashMap<Terminal, Production>());
        }
        for (Production p : grammar.getProductions()) add(p);
        return new ParseTable(grammar, cells, conflicts);
    }

    public static ParseTable build(Grammar grammar, FirstSets first,
                                   FollowSets follow) {
        return new TableBuilder(grammar, first, follow).build();
    }

}
