package net.llparse.ast;

import java.util.List;

public class ObjectLiteral extends Expr {

    private final List<Property> properties;

    public ObjectLiteral(List<Property> properties) {
        this.properties = freeze(properties);
    }

    public boolean equals(Object other) {
        return (other instanceof ObjectLiteral &&
                properties.equals(((ObjectLiteral) other).properties));
    }

    public int hashCode() {
        return properties.hashCode();
    }

    public Kind getKind() {
        return Kind.OBJECT_LITERAL;
    }

    public List<Property> getProperties() {
        return properties;
    }

    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitObjectLiteral(this);
    }

}
