package net.llparse.util.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class Production {

    private final int id;
    private final Nonterminal lhs;
    private final List<Symbol> rhs;

    public Production(int id, Nonterminal lhs, List<? extends Symbol> rhs) {
        if (lhs == null)
            throw new NullPointerException(
                "Production left-hand side may not be null");
        if (rhs == null)
            throw new NullPointerException(
                "Production right-hand side may not be null");
        this.id = id;
        this.lhs = lhs;
        // An empty right-hand side is spelled out as [epsilon].
        this.rhs = Collections.unmodifiableList((rhs.isEmpty()) ?
            Collections.<Symbol>singletonList(Terminal.EPSILON) :
            new ArrayList<Symbol>(rhs));
    }
    public Production(int id, Nonterminal lhs, Symbol... rhs) {
        this(id, lhs, Arrays.asList(rhs));
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(id).append(": ").append(lhs).append(" ->");
        for (Symbol s : rhs) sb.append(' ').append(s);
        return sb.toString();
    }

    public boolean equals(Object other) {
        if (! (other instanceof Production)) return false;
        Production po = (Production) other;
        return (getID() == po.getID() && getLHS().equals(po.getLHS()) &&
                getRHS().equals(po.getRHS()));
    }

    public int hashCode() {
        return id ^ lhs.hashCode() ^ rhs.hashCode();
    }

    public int getID() {
        return id;
    }

    public Nonterminal getLHS() {
        return lhs;
    }

    public List<Symbol> getRHS() {
        return rhs;
    }

    /* Whether this is exactly LHS -> epsilon. */
    public boolean isEpsilon() {
        return (rhs.size() == 1 && Terminal.EPSILON.equals(rhs.get(0)));
    }

}
