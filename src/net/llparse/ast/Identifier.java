package net.llparse.ast;

public class Identifier extends Expr {

    private final String symbol;

    public Identifier(String symbol) {
        this.symbol = require(symbol, "Symbol");
    }

    public boolean equals(Object other) {
        return (other instanceof Identifier &&
                symbol.equals(((Identifier) other).symbol));
    }

    public int hashCode() {
        return symbol.hashCode();
    }

    public Kind getKind() {
        return Kind.IDENTIFIER;
    }

    public String getSymbol() {
        return symbol;
    }

    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

}
