package net.llparse.ast;

public interface ExprVisitor<R> {

    R visitAssignmentExpr(AssignmentExpr node);

    R visitBinaryExpr(BinaryExpr node);

    R visitUnaryExpr(UnaryExpr node);

    R visitCallExpr(CallExpr node);

    R visitMemberExpr(MemberExpr node);

    R visitIdentifier(Identifier node);

    R visitNumericLiteral(NumericLiteral node);

    R visitStringLiteral(StringLiteral node);

    R visitArrayLiteral(ArrayLiteral node);

    R visitObjectLiteral(ObjectLiteral node);

}
