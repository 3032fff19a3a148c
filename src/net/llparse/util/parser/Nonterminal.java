package net.llparse.util.parser;

public class Nonterminal extends Symbol {

    public Nonterminal(String name) {
        super(name);
    }

    public boolean isTerminal() {
        return false;
    }

}
