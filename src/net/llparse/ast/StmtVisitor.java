package net.llparse.ast;

public interface StmtVisitor<R> {

    R visitProgram(Program node);

    R visitVarDeclaration(VarDeclaration node);

    R visitFunctionDeclaration(FunctionDeclaration node);

    R visitIfStatement(IfStatement node);

    R visitWhileStatement(WhileStatement node);

    R visitForStatement(ForStatement node);

    R visitReturnStatement(ReturnStatement node);

    R visitBreakStatement(BreakStatement node);

    R visitContinueStatement(ContinueStatement node);

    R visitExpressionStatement(ExpressionStatement node);

}
