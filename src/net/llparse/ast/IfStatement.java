package net.llparse.ast;

import java.util.List;
import java.util.Objects;

/**
 * A conditional. The else branch is null if absent (as opposed to an
 * empty list for "else {}").
 */
public class IfStatement extends Stmt {

    private final Expr condition;
    private final List<Stmt> thenBranch;
    private final List<Stmt> elseBranch;

    public IfStatement(Expr condition, List<? extends Stmt> thenBranch,
                       List<? extends Stmt> elseBranch) {
        this.condition = require(condition, "Condition");
        this.thenBranch = freeze(thenBranch);
        this.elseBranch = (elseBranch == null) ? null : freeze(elseBranch);
    }

    public boolean equals(Object other) {
        if (! (other instanceof IfStatement)) return false;
        IfStatement io = (IfStatement) other;
        return (condition.equals(io.condition) &&
                thenBranch.equals(io.thenBranch) &&
                Objects.equals(elseBranch, io.elseBranch));
    }

    public int hashCode() {
        return Objects.hash(condition, thenBranch, elseBranch);
    }

    public Kind getKind() {
        return Kind.IF_STATEMENT;
    }

    public Expr getCondition() {
        return condition;
    }

    public List<Stmt> getThen() {
        return thenBranch;
    }

    public List<Stmt> getElse() {
        return elseBranch;
    }

    public boolean hasElse() {
        return (elseBranch != null);
    }

    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitIfStatement(this);
    }

}
