package net.llparse.ast;

import java.util.Objects;

/**
 * A let or const declaration. Constant declarations always carry a value;
 * the value of a mutable one may be null.
 */
public class VarDeclaration extends Stmt {

    private final boolean constant;
    private final String identifier;
    private final Expr value;

    public VarDeclaration(boolean constant, String identifier, Expr value) {
        if (constant && value == null)
            throw new IllegalArgumentException(
                "Constant declaration of " + identifier + " needs a value");
        this.constant = constant;
        this.identifier = require(identifier, "Identifier");
        this.value = value;
    }

    public boolean equals(Object other) {
        if (! (other instanceof VarDeclaration)) return false;
        VarDeclaration vo = (VarDeclaration) other;
        return (constant == vo.constant &&
                identifier.equals(vo.identifier) &&
                Objects.equals(value, vo.value));
    }

    public int hashCode() {
        return Objects.hash(constant, identifier, value);
    }

    public Kind getKind() {
        return Kind.VAR_DECLARATION;
    }

    public boolean isConstant() {
        return constant;
    }

    public String getIdentifier() {
        return identifier;
    }

    public Expr getValue() {
        return value;
    }

    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitVarDeclaration(this);
    }

}
