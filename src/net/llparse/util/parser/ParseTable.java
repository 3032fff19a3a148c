package net.llparse.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.llparse.api.parser.GrammarConflictException;

public class ParseTable {

    public static class Conflict implements GrammarConflictException.Conflict {

        private final Nonterminal nonterminal;
        private final Terminal terminal;
        private final Production existing;
        private final Production candidate;

        public Conflict(Nonterminal nonterminal, Terminal terminal,
                        Production existing, Production candidate) {
            this.nonterminal = nonterminal;
            this.terminal = terminal;
            this.existing = existing;
            this.candidate = candidate;
        }

        public String toString() {
            return GrammarConflictException.formatConflict(this);
        }

        public boolean equals(Object other) {
            if (! (other instanceof Conflict)) return false;
            Conflict co = (Conflict) other;
            return (nonterminal.equals(co.nonterminal) &&
                    terminal.equals(co.terminal) &&
                    existing.equals(co.existing) &&
                    candidate.equals(co.candidate));
        }

        public int hashCode() {
            return nonterminal.hashCode() ^ terminal.hashCode() ^
                existing.getID() ^ (candidate.getID() << 16);
        }

        public Nonterminal getNonterminal() {
            return nonterminal;
        }

        public Terminal getTerminal() {
            return terminal;
        }

        public Production getExisting() {
            return existing;
        }

        public Production getCandidate() {
            return candidate;
        }

        public String getNonterminalName() {
            return nonterminal.getName();
        }

        public String getTerminalName() {
            return terminal.getName();
        }

        public int getExistingProductionID() {
            return existing.getID();
        }

        public int getCandidateProductionID() {
            return candidate.getID();
        }

    }

    private final Grammar grammar;
    private final Map<Nonterminal, Map<Terminal, Production>> cells;
    private final List<Conflict> conflicts;

    public ParseTable(Grammar grammar,
            Map<Nonterminal, ? extends Map<Terminal, Production>> cells,
            List<Conflict> conflicts) {
        Map<Nonterminal, Map<Terminal, Production>> copy =
            new LinkedHashMap<Nonterminal, Map<Terminal, Production>>();
        for (Map.Entry<Nonterminal, ? extends Map<Terminal, Production>> e :
                 cells.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableMap(
                new LinkedHashMap<Terminal, Production>(e.getValue())));
        }
        this.grammar = grammar;
        this.cells = Collections.unmodifiableMap(copy);
        this.conflicts = Collections.unmodifiableList(
            new ArrayList<Conflict>(conflicts));
    }

    public String toString() {
        return getClass().getName() + cells;
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public Map<Nonterminal, Map<Terminal, Production>> asMap() {
        return cells;
    }

    public Production get(Nonterminal nt, Terminal t) {
        return getRow(nt).get(t);
    }

    public Map<Terminal, Production> getRow(Nonterminal nt) {
        Map<Terminal, Production> ret = cells.get(nt);
        return (ret == null) ?
            Collections.<Terminal, Production>emptyMap() : ret;
    }

    public List<Conflict> getConflicts() {
        return conflicts;
    }

    public boolean isLL1() {
        return conflicts.isEmpty();
    }

    /* Render the table as text: one row per nonterminal, one column per
     * terminal, cells holding production IDs (or "-" when empty). */
    public String format() {
        List<String> header = new ArrayList<String>();
        header.add("");
        List<Terminal> columns = new ArrayList<Terminal>();
        for (Terminal t : grammar.getTerminals()) {
            columns.add(t);
            header.add(t.getName());
        }
        List<List<String>> rows = new ArrayList<List<String>>();
        rows.add(header);
        for (Nonterminal nt : grammar.getNonterminals()) {
            List<String> row = new ArrayList<String>();
            row.add(nt.getName());
            for (Terminal t : columns) {
                Production p = get(nt, t);
                row.add((p == null) ? "-" : String.valueOf(p.getID()));
            }
            rows.add(row);
        }
        int[] widths = new int[header.size()];
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }
        StringBuilder sb = new StringBuilder();
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                if (i != 0) sb.append(" | ");
                String cell = row.get(i);
                sb.append(cell);
                for (int j = cell.length(); j < widths[i]; j++)
                    sb.append(' ');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

}
