package net.llparse.util.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.llparse.api.parser.InvalidGrammarException;

public class Grammar {

    private final Map<String, Terminal> terminals;
    private final Map<String, Nonterminal> nonterminals;
    private final List<Production> productions;
    private Nonterminal startSymbol;
    private Terminal operatorClass;
    private int nextID;
    private boolean frozen;

    public Grammar() {
        terminals = new LinkedHashMap<String, Terminal>();
        nonterminals = new LinkedHashMap<String, Nonterminal>();
        productions = new ArrayList<Production>();
        nextID = 1;
        terminals.put(Terminal.END_MARKER.getName(), Terminal.END_MARKER);
    }
    public Grammar(Grammar other) {
        this();
        terminals.putAll(other.terminals);
        nonterminals.putAll(other.nonterminals);
        productions.addAll(other.productions);
        startSymbol = other.startSymbol;
        operatorClass = other.operatorClass;
        nextID = other.nextID;
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getName());
        sb.append('@');
        sb.append(Integer.toHexString(hashCode()));
        sb.append("[start=").append(startSymbol);
        for (Production p : productions) {
            sb.append(',').append(p);
        }
        sb.append(']');
        return sb.toString();
    }

    protected void checkMutable() {
        if (frozen)
            throw new IllegalStateException("Grammar is frozen");
    }

    public boolean isFrozen() {
        return frozen;
    }

    /* Return an immutable copy of this grammar (or this grammar itself if
     * it is already immutable). */
    public Grammar snapshot() {
        if (frozen) return this;
        Grammar ret = new Grammar(this);
        ret.frozen = true;
        return ret;
    }

    public Terminal addTerminal(String name) {
        checkMutable();
        Terminal ret = terminals.get(name);
        if (ret == null) {
            ret = new Terminal(name);
            terminals.put(name, ret);
        }
        return ret;
    }
    public void addTerminals(String... names) {
        for (String n : names) addTerminal(n);
    }

    public Nonterminal addNonterminal(String name) {
        checkMutable();
        Nonterminal ret = nonterminals.get(name);
        if (ret == null) {
            ret = new Nonterminal(name);
            nonterminals.put(name, ret);
        }
        return ret;
    }
    public void addNonterminals(String... names) {
        for (String n : names) addNonterminal(n);
    }

    public Production addProduction(Production prod) {
        checkMutable();
        productions.add(prod);
        if (prod.getID() >= nextID) nextID = prod.getID() + 1;
        return prod;
    }
    public Production addProduction(Nonterminal lhs, List<Symbol> rhs) {
        return addProduction(new Production(nextID, lhs, rhs));
    }
    /* Symbols are looked up by name among the declared terminals and
     * nonterminals; the name of Terminal.EPSILON denotes the empty
     * derivation. Names that are declared nowhere are kept as references
     * to undeclared nonterminals and reported by check(). */
    public Production addProduction(String lhs, String... rhs) {
        Nonterminal left = nonterminals.get(lhs);
        if (left == null) left = new Nonterminal(lhs);
        List<Symbol> right = new ArrayList<Symbol>(rhs.length);
        for (String name : rhs) right.add(resolve(name));
        return addProduction(left, right);
    }

    protected Symbol resolve(String name) {
        if (Terminal.EPSILON.getName().equals(name))
            return Terminal.EPSILON;
        Symbol ret = terminals.get(name);
        if (ret == null) ret = nonterminals.get(name);
        if (ret == null) ret = new Nonterminal(name);
        return ret;
    }

    public void setStartSymbol(Nonterminal sym) {
        checkMutable();
        startSymbol = sym;
    }
    public void setStartSymbol(String name) {
        Nonterminal sym = nonterminals.get(name);
        setStartSymbol((sym == null) ? new Nonterminal(name) : sym);
    }

    /* Designate a terminal that matches any operator token (as determined
     * by the TerminalMapper) regardless of its literal text. */
    public void setOperatorClass(Terminal term) {
        checkMutable();
        operatorClass = term;
    }
    public void setOperatorClass(String name) {
        setOperatorClass(addTerminal(name));
    }

    public Nonterminal getStartSymbol() {
        return startSymbol;
    }

    public Terminal getOperatorClass() {
        return operatorClass;
    }

    public Collection<Terminal> getTerminals() {
        return Collections.unmodifiableCollection(terminals.values());
    }

    public Collection<Nonterminal> getNonterminals() {
        return Collections.unmodifiableCollection(nonterminals.values());
    }

    public List<Production> getProductions() {
        return Collections.unmodifiableList(productions);
    }
    public List<Production> getProductions(Nonterminal lhs) {
        List<Production> ret = new ArrayList<Production>();
        for (Production p : productions) {
            if (p.getLHS().equals(lhs)) ret.add(p);
        }
        return ret;
    }

    public Production getProduction(int id) {
        for (Production p : productions) {
            if (p.getID() == id) return p;
        }
        return null;
    }

    public Terminal getTerminal(String name) {
        return terminals.get(name);
    }

    public Nonterminal getNonterminal(String name) {
        return nonterminals.get(name);
    }

    public boolean isTerminal(Symbol sym) {
        return (sym instanceof Terminal &&
                terminals.containsKey(sym.getName()));
    }

    public boolean isNonterminal(Symbol sym) {
        return (sym instanceof Nonterminal &&
                nonterminals.containsKey(sym.getName()));
    }

    public List<String> check() {
        List<String> issues = new ArrayList<String>();
        if (startSymbol == null) {
            issues.add("Missing start symbol");
        } else if (! isNonterminal(startSymbol)) {
            issues.add("Start symbol " + startSymbol +
                " is not a nonterminal of the grammar");
        }
        for (String name : terminals.keySet()) {
            if (nonterminals.containsKey(name))
                issues.add("Symbol " + name +
                    " is both a terminal and a nonterminal");
        }
        if (terminals.containsKey(Terminal.EPSILON.getName()))
            issues.add("The empty-derivation marker may not be declared " +
                "as a terminal");
        if (operatorClass != null && ! isTerminal(operatorClass))
            issues.add("Operator class " + operatorClass +
                " is not a terminal of the grammar");
        Set<Integer> seenIDs = new HashSet<Integer>();
        for (Production p : productions) {
            if (! seenIDs.add(p.getID()))
                issues.add("Duplicate production ID " + p.getID());
            if (! isNonterminal(p.getLHS()))
                issues.add("Production " + p.getID() + ": left-hand side " +
                    p.getLHS() + " is not a declared nonterminal");
            List<Symbol> rhs = p.getRHS();
            if (rhs.size() > 1 && rhs.contains(Terminal.EPSILON))
                issues.add("Production " + p.getID() + ": " +
                    Terminal.EPSILON + " mixed with other symbols");
            for (Symbol s : rhs) {
                if (Terminal.EPSILON.equals(s) || isTerminal(s) ||
                        isNonterminal(s))
                    continue;
                issues.add("Production " + p.getID() + ": undefined " +
                    "symbol " + s);
            }
        }
        return issues;
    }

    public void validate() throws InvalidGrammarException {
        List<String> issues = check();
        if (! issues.isEmpty())
            throw new InvalidGrammarException(issues);
    }

    public static List<Symbol> symbols(Symbol... syms) {
        return Arrays.asList(syms);
    }

}
