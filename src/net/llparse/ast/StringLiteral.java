package net.llparse.ast;

public class StringLiteral extends Expr {

    private final String value;

    public StringLiteral(String value) {
        this.value = require(value, "Value");
    }

    public boolean equals(Object other) {
        return (other instanceof StringLiteral &&
                value.equals(((StringLiteral) other).value));
    }

    public int hashCode() {
        return value.hashCode() ^ 0x55;
    }

    public Kind getKind() {
        return Kind.STRING_LITERAL;
    }

    public String getValue() {
        return value;
    }

    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }

}
