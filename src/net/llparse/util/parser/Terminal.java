package net.llparse.util.parser;

public class Terminal extends Symbol {

    /* The empty derivation. Only valid as the sole symbol of a production
     * and inside FIRST sets. */
    public static final Terminal EPSILON = new Terminal("ε");

    /* End of input. Part of every grammar's terminal set. */
    public static final Terminal END_MARKER = new Terminal("$");

    public Terminal(String name) {
        super(name);
    }

    public boolean isTerminal() {
        return true;
    }

    public boolean isEpsilon() {
        return EPSILON.equals(this);
    }

    public boolean isEndMarker() {
        return END_MARKER.equals(this);
    }

}
