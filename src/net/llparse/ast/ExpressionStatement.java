package net.llparse.ast;

public class ExpressionStatement extends Stmt {

    private final Expr expression;

    public ExpressionStatement(Expr expression) {
        this.expression = require(expression, "Expression");
    }

    public boolean equals(Object other) {
        return (other instanceof ExpressionStatement &&
                expression.equals(((ExpressionStatement) other).expression));
    }

    public int hashCode() {
        return expression.hashCode() ^ 0x2A;
    }

    public Kind getKind() {
        return Kind.EXPRESSION_STATEMENT;
    }

    public Expr getExpression() {
        return expression;
    }

    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }

}
