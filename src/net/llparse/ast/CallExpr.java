package net.llparse.ast;

import java.util.List;
import java.util.Objects;

public class CallExpr extends Expr {

    private final Expr caller;
    private final List<Expr> args;

    public CallExpr(Expr caller, List<? extends Expr> args) {
        this.caller = require(caller, "Callee");
        this.args = freeze(args);
    }

    public boolean equals(Object other) {
        if (! (other instanceof CallExpr)) return false;
        CallExpr co = (CallExpr) other;
        return (caller.equals(co.caller) && args.equals(co.args));
    }

    public int hashCode() {
        return Objects.hash(caller, args);
    }

    public Kind getKind() {
        return Kind.CALL_EXPR;
    }

    public Expr getCaller() {
        return caller;
    }

    public List<Expr> getArgs() {
        return args;
    }

    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCallExpr(this);
    }

}
