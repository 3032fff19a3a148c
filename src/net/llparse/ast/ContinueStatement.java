package net.llparse.ast;

public class ContinueStatement extends Stmt {

    public boolean equals(Object other) {
        return (other instanceof ContinueStatement);
    }

    public int hashCode() {
        return Kind.CONTINUE_STATEMENT.ordinal();
    }

    public Kind getKind() {
        return Kind.CONTINUE_STATEMENT;
    }

    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitContinueStatement(this);
    }

}
