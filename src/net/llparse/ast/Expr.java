package net.llparse.ast;

/**
 * An expression. Expressions produce values when evaluated.
 */
public abstract class Expr extends Node {

    public abstract <R> R accept(ExprVisitor<R> visitor);

}
