package net.llparse.ast;

import java.util.List;
import java.util.Objects;

/**
 * A C-style for loop. The initializer is either a VarDeclaration or an
 * ExpressionStatement; it, the condition, and the update may each be
 * null.
 */
public class ForStatement extends Stmt {

    private final Stmt init;
    private final Expr condition;
    private final Expr update;
    private final List<Stmt> body;

    public ForStatement(Stmt init, Expr condition, Expr update,
                        List<? extends Stmt> body) {
        this.init = init;
        this.condition = condition;
        this.update = update;
        this.body = freeze(body);
    }

    public boolean equals(Object other) {
        if (! (other instanceof ForStatement)) return false;
        ForStatement fo = (ForStatement) other;
        return (Objects.equals(init, fo.init) &&
                Objects.equals(condition, fo.condition) &&
                Objects.equals(update, fo.update) &&
                body.equals(fo.body));
    }

    public int hashCode() {
        return Objects.hash(init, condition, update, body);
    }

    public Kind getKind() {
        return Kind.FOR_STATEMENT;
    }

    public Stmt getInit() {
        return init;
    }

    public Expr getCondition() {
        return condition;
    }

    public Expr getUpdate() {
        return update;
    }

    public List<Stmt> getBody() {
        return body;
    }

    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitForStatement(this);
    }

}
