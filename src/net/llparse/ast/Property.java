package net.llparse.ast;

import java.util.Objects;

/**
 * A key-value pair of an object literal. Shorthand properties ("{ x }")
 * have a null value.
 */
public class Property extends Node {

    private final String key;
    private final Expr value;

    public Property(String key, Expr value) {
        this.key = require(key, "Key");
        this.value = value;
    }

    public boolean equals(Object other) {
        if (! (other instanceof Property)) return false;
        Property po = (Property) other;
        return (key.equals(po.key) && Objects.equals(value, po.value));
    }

    public int hashCode() {
        return Objects.hash(key, value);
    }

    public Kind getKind() {
        return Kind.PROPERTY;
    }

    public String getKey() {
        return key;
    }

    public Expr getValue() {
        return value;
    }

    public boolean isShorthand() {
        return (value == null);
    }

}
