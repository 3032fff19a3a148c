package net.llparse.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of all abstract syntax tree nodes.
 * AST nodes are immutable and compare structurally; their string
 * representation is their JSON rendering as produced by AstJson.
 */
public abstract class Node {

    /**
     * The node variants; every concrete node class has exactly one.
     */
    public enum Kind {
        PROGRAM("Program"),
        VAR_DECLARATION("VarDeclaration"),
        FUNCTION_DECLARATION("FunctionDeclaration"),
        IF_STATEMENT("IfStatement"),
        WHILE_STATEMENT("WhileStatement"),
        FOR_STATEMENT("ForStatement"),
        RETURN_STATEMENT("ReturnStatement"),
        BREAK_STATEMENT("BreakStatement"),
        CONTINUE_STATEMENT("ContinueStatement"),
        EXPRESSION_STATEMENT("ExpressionStatement"),
        ASSIGNMENT_EXPR("AssignmentExpr"),
        BINARY_EXPR("BinaryExpr"),
        UNARY_EXPR("UnaryExpr"),
        CALL_EXPR("CallExpr"),
        MEMBER_EXPR("MemberExpr"),
        IDENTIFIER("Identifier"),
        NUMERIC_LITERAL("NumericLiteral"),
        STRING_LITERAL("StringLiteral"),
        ARRAY_LITERAL("ArrayLiteral"),
        OBJECT_LITERAL("ObjectLiteral"),
        PROPERTY("Property");

        private final String typeName;

        private Kind(String typeName) {
            this.typeName = typeName;
        }

        /**
         * The name of this kind as used in serialized ASTs.
         */
        public String getTypeName() {
            return typeName;
        }

    }

    /**
     * The variant of this node.
     */
    public abstract Kind getKind();

    public String toString() {
        return AstJson.toJSON(this).toString();
    }

    protected static <T> List<T> freeze(List<? extends T> items) {
        if (items == null)
            throw new NullPointerException("Node list may not be null");
        return Collections.unmodifiableList(new ArrayList<T>(items));
    }

    protected static <T> T require(T value, String what) {
        if (value == null)
            throw new NullPointerException(what + " may not be null");
        return value;
    }

}
