package net.llparse.ast;

import java.util.List;

/**
 * The root of an AST: the statements of one source text.
 */
public class Program extends Stmt {

    private final List<Stmt> body;

    public Program(List<? extends Stmt> body) {
        this.body = freeze(body);
    }

    public boolean equals(Object other) {
        return (other instanceof Program &&
                body.equals(((Program) other).body));
    }

    public int hashCode() {
        return body.hashCode();
    }

    public Kind getKind() {
        return Kind.PROGRAM;
    }

    public List<Stmt> getBody() {
        return body;
    }

    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }

}
