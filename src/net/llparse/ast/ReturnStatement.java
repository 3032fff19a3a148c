package net.llparse.ast;

import java.util.Objects;

public class ReturnStatement extends Stmt {

    private final Expr value;

    public ReturnStatement(Expr value) {
        this.value = value;
    }

    public boolean equals(Object other) {
        return (other instanceof ReturnStatement &&
                Objects.equals(value, ((ReturnStatement) other).value));
    }

    public int hashCode() {
        return Objects.hashCode(value);
    }

    public Kind getKind() {
        return Kind.RETURN_STATEMENT;
    }

    /* Null for a bare "return;". */
    public Expr getValue() {
        return value;
    }

    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitReturnStatement(this);
    }

}
