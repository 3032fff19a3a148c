package net.llparse.ast;

import java.util.List;
import java.util.Objects;

public class FunctionDeclaration extends Stmt {

    private final String name;
    private final List<String> parameters;
    private final List<Stmt> body;

    public FunctionDeclaration(String name, List<String> parameters,
                               List<? extends Stmt> body) {
        this.name = require(name, "Function name");
        this.parameters = freeze(parameters);
        this.body = freeze(body);
    }

    public boolean equals(Object other) {
        if (! (other instanceof FunctionDeclaration)) return false;
        FunctionDeclaration fo = (FunctionDeclaration) other;
        return (name.equals(fo.name) && parameters.equals(fo.parameters) &&
                body.equals(fo.body));
    }

    public int hashCode() {
        return Objects.hash(name, parameters, body);
    }

    public Kind getKind() {
        return Kind.FUNCTION_DECLARATION;
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public List<Stmt> getBody() {
        return body;
    }

    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitFunctionDeclaration(this);
    }

}
