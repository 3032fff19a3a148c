package net.llparse.ast;

import java.util.Objects;

public class UnaryExpr extends Expr {

    private final String operator;
    private final Expr argument;

    public UnaryExpr(String operator, Expr argument) {
        this.operator = require(operator, "Operator");
        this.argument = require(argument, "Argument");
    }

    public boolean equals(Object other) {
        if (! (other instanceof UnaryExpr)) return false;
        UnaryExpr uo = (UnaryExpr) other;
        return (operator.equals(uo.operator) &&
                argument.equals(uo.argument));
    }

    public int hashCode() {
        return Objects.hash(operator, argument);
    }

    public Kind getKind() {
        return Kind.UNARY_EXPR;
    }

    public String getOperator() {
        return operator;
    }

    public Expr getArgument() {
        return argument;
    }

    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnaryExpr(this);
    }

}
