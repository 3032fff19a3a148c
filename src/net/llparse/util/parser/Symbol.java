package net.llparse.util.parser;

import net.llparse.api.NamedValue;

public abstract class Symbol implements NamedValue {

    private final String name;

    protected Symbol(String name) {
        if (name == null)
            throw new NullPointerException("Symbol name may not be null");
        this.name = name;
    }

    public String toString() {
        return name;
    }

    public boolean equals(Object other) {
        if (! (other instanceof Symbol)) return false;
        Symbol so = (Symbol) other;
        return (isTerminal() == so.isTerminal() &&
                getName().equals(so.getName()));
    }

    public int hashCode() {
        return name.hashCode() ^ (isTerminal() ? 0x5A5A : 0);
    }

    public String getName() {
        return name;
    }

    public abstract boolean isTerminal();

}
