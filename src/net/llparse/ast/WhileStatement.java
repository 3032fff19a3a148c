package net.llparse.ast;

import java.util.List;
import java.util.Objects;

public class WhileStatement extends Stmt {

    private final Expr condition;
    private final List<Stmt> body;

    public WhileStatement(Expr condition, List<? extends Stmt> body) {
        this.condition = require(condition, "Condition");
        this.body = freeze(body);
    }

    public boolean equals(Object other) {
        if (! (other instanceof WhileStatement)) return false;
        WhileStatement wo = (WhileStatement) other;
        return (condition.equals(wo.condition) && body.equals(wo.body));
    }

    public int hashCode() {
        return Objects.hash(condition, body);
    }

    public Kind getKind() {
        return Kind.WHILE_STATEMENT;
    }

    public Expr getCondition() {
        return condition;
    }

    public List<Stmt> getBody() {
        return body;
    }

    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitWhileStatement(this);
    }

}
