package net.llparse.ast;

import java.util.List;

public class ArrayLiteral extends Expr {

    private final List<Expr> elements;

    public ArrayLiteral(List<? extends Expr> elements) {
        this.elements = freeze(elements);
    }

    public boolean equals(Object other) {
        return (other instanceof ArrayLiteral &&
                elements.equals(((ArrayLiteral) other).elements));
    }

    public int hashCode() {
        return elements.hashCode();
    }

    public Kind getKind() {
        return Kind.ARRAY_LITERAL;
    }

    public List<Expr> getElements() {
        return elements;
    }

    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitArrayLiteral(this);
    }

}
