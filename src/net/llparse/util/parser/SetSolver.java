package net.llparse.util.parser;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

public final class SetSolver {

    private static final Logger LOGGER = Logger.getLogger("SetSolver");

    private SetSolver() {}

    public static FirstSets computeFirst(Grammar grammar) {
        return computeFirst(grammar, null);
    }
    /* If seed is non-null, its sets are used as the starting point of the
     * iteration; this is used to check that a result is a fixed point. */
    public static FirstSets computeFirst(Grammar grammar, FirstSets seed) {
        Map<Symbol, Set<Terminal>> sets =
            new LinkedHashMap<Symbol, Set<Terminal>>();
        for (Terminal t : grammar.getTerminals()) {
            Set<Terminal> s = new LinkedHashSet<Terminal>();
            s.add(t);
            sets.put(t, s);
        }
        for (Nonterminal nt : grammar.getNonterminals()) {
            Set<Terminal> s = new LinkedHashSet<Terminal>();
            if (seed != null) s.addAll(seed.get(nt));
            sets.put(nt, s);
        }
        int passes = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            passes++;
            for (Production p : grammar.getProductions()) {
                Set<Terminal> target = sets.get(p.getLHS());
                if (target == null) continue;
                if (target.addAll(firstOfSequence(p.getRHS(), sets)))
                    changed = true;
            }
        }
        LOGGER.fine("FIRST sets of " + sets.size() + " symbols computed " +
            "in " + passes + " passes");
        return new FirstSets(sets, passes);
    }

    public static FollowSets computeFollow(Grammar grammar,
                                           FirstSets first) {
        return computeFollow(grammar, first, null);
    }
    public static FollowSets computeFollow(Grammar grammar, FirstSets first,
                                           FollowSets seed) {
        Map<Nonterminal, Set<Terminal>> sets =
            new LinkedHashMap<Nonterminal, Set<Terminal>>();
        for (Nonterminal nt : grammar.getNonterminals()) {
            Set<Terminal> s = new LinkedHashSet<Terminal>();
            if (seed != null) s.addAll(seed.get(nt));
            sets.put(nt, s);
        }
        Set<Terminal> startSet = sets.get(grammar.getStartSymbol());
        if (startSet != null) startSet.add(Terminal.END_MARKER);
        int passes = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            passes++;
            for (Production p : grammar.getProductions()) {
                List<Symbol> rhs = p.getRHS();
                for (int i = 0; i < rhs.size(); i++) {
                    Symbol sym = rhs.get(i);
                    if (sym.isTerminal()) continue;
                    Set<Terminal> target = sets.get(sym);
                    if (target == null) continue;
                    Set<Terminal> rest = firstOfSequence(
                        rhs.subList(i + 1, rhs.size()), first);
                    for (Terminal t : rest) {
                        if (t.isEpsilon()) continue;
                        if (target.add(t)) changed = true;
                    }
                    if (rest.contains(Terminal.EPSILON)) {
                        Set<Terminal> lhsSet = sets.get(p.getLHS());
                        if (lhsSet != null && target.addAll(lhsSet))
                            changed = true;
                    }
                }
            }
        }
        LOGGER.fine("FOLLOW sets of " + sets.size() + " nonterminals " +
            "computed in " + passes + " passes");
        return new FollowSets(sets, passes);
    }

    /* FIRST of a symbol sequence. The empty sequence (and the sequence
     * consisting of epsilon alone) yields {epsilon}. */
    public static Set<Terminal> firstOfSequence(List<Symbol> seq,
                                                FirstSets first) {
        return firstOfSequence(seq, first.asMap());
    }

    private static Set<Terminal> firstOfSequence(List<Symbol> seq,
            Map<? extends Symbol, ? extends Set<Terminal>> first) {
        Set<Terminal> ret = new LinkedHashSet<Terminal>();
        for (Symbol sym : seq) {
            if (Terminal.EPSILON.equals(sym)) continue;
            Set<Terminal> fs = first.get(sym);
            if (fs == null) {
                if (! sym.isTerminal()) return ret;
                ret.add((Terminal) sym);
                return ret;
            }
            boolean nullable = false;
            for (Terminal t : fs) {
                if (t.isEpsilon()) {
                    nullable = true;
                } else {
                    ret.add(t);
                }
            }
            if (! nullable) return ret;
        }
        ret.add(Terminal.EPSILON);
        return ret;
    }

}
