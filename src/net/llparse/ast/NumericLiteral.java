package net.llparse.ast;

public class NumericLiteral extends Expr {

    private final double value;

    public NumericLiteral(double value) {
        this.value = value;
    }

    public boolean equals(Object other) {
        return (other instanceof NumericLiteral &&
                Double.compare(value, ((NumericLiteral) other).value) == 0);
    }

    public int hashCode() {
        return Double.hashCode(value);
    }

    public Kind getKind() {
        return Kind.NUMERIC_LITERAL;
    }

    public double getValue() {
        return value;
    }

    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNumericLiteral(this);
    }

}
