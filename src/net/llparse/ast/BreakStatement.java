package net.llparse.ast;

public class BreakStatement extends Stmt {

    public boolean equals(Object other) {
        return (other instanceof BreakStatement);
    }

    public int hashCode() {
        return Kind.BREAK_STATEMENT.ordinal();
    }

    public Kind getKind() {
        return Kind.BREAK_STATEMENT;
    }

    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitBreakStatement(this);
    }

}
