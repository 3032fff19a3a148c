package net.llparse.ast;

import java.util.Objects;

/**
 * A binary operation, covering arithmetic as well as comparisons.
 */
public class BinaryExpr extends Expr {

    private final Expr left;
    private final String operator;
    private final Expr right;

    public BinaryExpr(Expr left, String operator, Expr right) {
        this.left = require(left, "Left operand");
        this.operator = require(operator, "Operator");
        this.right = require(right, "Right operand");
    }

    public boolean equals(Object other) {
        if (! (other instanceof BinaryExpr)) return false;
        BinaryExpr bo = (BinaryExpr) other;
        return (left.equals(bo.left) && operator.equals(bo.operator) &&
                right.equals(bo.right));
    }

    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    public Kind getKind() {
        return Kind.BINARY_EXPR;
    }

    public Expr getLeft() {
        return left;
    }

    public String getOperator() {
        return operator;
    }

    public Expr getRight() {
        return right;
    }

    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinaryExpr(this);
    }

}
