package net.llparse.api.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when a grammar is not LL(1).
 * This is raised at parser construction time if some parse table cell
 * received more than one candidate production. All conflicts detected during
 * table construction are reported together.
 */
public class GrammarConflictException extends ParserException {

    /**
     * A single conflicting parse table cell.
     */
    public interface Conflict {

        /**
         * The name of the nonterminal indexing the table row.
         */
        String getNonterminalName();

        /**
         * The name of the lookahead terminal indexing the table column.
         */
        String getTerminalName();

        /**
         * The ID of the production that occupied the cell first.
         */
        int getExistingProductionID();

        /**
         * The ID of the production that would have been stored in the cell
         * as well.
         */
        int getCandidateProductionID();

    }

    private final List<Conflict> conflicts;

    public GrammarConflictException(List<? extends Conflict> conflicts) {
        super(formatConflicts(conflicts));
        this.conflicts = Collections.unmodifiableList(
            new ArrayList<Conflict>(conflicts));
    }
    public GrammarConflictException(String message) {
        super(message);
        this.conflicts = Collections.emptyList();
    }
    public GrammarConflictException(String message, Throwable cause) {
        super(message, cause);
        this.conflicts = Collections.emptyList();
    }

    /**
     * The conflicts that caused this exception.
     */
    public List<Conflict> getConflicts() {
        return conflicts;
    }

    public static String formatConflict(Conflict c) {
        return String.format("[%s, %s]: productions %d and %d",
            c.getNonterminalName(), c.getTerminalName(),
            c.getExistingProductionID(), c.getCandidateProductionID());
    }

    private static String formatConflicts(List<? extends Conflict> cs) {
        StringBuilder sb = new StringBuilder("Grammar is not LL(1): ");
        sb.append(cs.size()).append(cs.size() == 1 ? " conflict" :
                                                     " conflicts");
        for (Conflict c : cs) {
            sb.append("; ").append(formatConflict(c));
        }
        return sb.toString();
    }

}
