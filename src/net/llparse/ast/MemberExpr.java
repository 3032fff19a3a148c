package net.llparse.ast;

import java.util.Objects;

/**
 * A member access. For "a.b", the property is the Identifier b and the
 * access is not computed; for "a[b]", the property is an arbitrary
 * expression and the access is computed.
 */
public class MemberExpr extends Expr {

    private final Expr object;
    private final Expr property;
    private final boolean computed;

    public MemberExpr(Expr object, Expr property, boolean computed) {
        this.object = require(object, "Object");
        this.property = require(property, "Property");
        this.computed = computed;
    }

    public boolean equals(Object other) {
        if (! (other instanceof MemberExpr)) return false;
        MemberExpr mo = (MemberExpr) other;
        return (object.equals(mo.object) && property.equals(mo.property) &&
                computed == mo.computed);
    }

    public int hashCode() {
        return Objects.hash(object, property, computed);
    }

    public Kind getKind() {
        return Kind.MEMBER_EXPR;
    }

    public Expr getObject() {
        return object;
    }

    public Expr getProperty() {
        return property;
    }

    public boolean isComputed() {
        return computed;
    }

    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitMemberExpr(this);
    }

}
