package net.llparse.ast;

/**
 * A statement. Statements do not produce values.
 */
public abstract class Stmt extends Node {

    public abstract <R> R accept(StmtVisitor<R> visitor);

}
