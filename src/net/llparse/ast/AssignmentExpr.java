package net.llparse.ast;

import java.util.Objects;

public class AssignmentExpr extends Expr {

    private final Expr assignee;
    private final Expr value;

    public AssignmentExpr(Expr assignee, Expr value) {
        this.assignee = require(assignee, "Assignee");
        this.value = require(value, "Value");
    }

    public boolean equals(Object other) {
        if (! (other instanceof AssignmentExpr)) return false;
        AssignmentExpr ao = (AssignmentExpr) other;
        return (assignee.equals(ao.assignee) && value.equals(ao.value));
    }

    public int hashCode() {
        return Objects.hash(assignee, value);
    }

    public Kind getKind() {
        return Kind.ASSIGNMENT_EXPR;
    }

    public Expr getAssignee() {
        return assignee;
    }

    public Expr getValue() {
        return value;
    }

    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitAssignmentExpr(this);
    }

}
