package net.llparse.ast;

import java.util.List;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Renders ASTs as JSON.
 * Every node becomes an object whose "kind" member holds the type name of
 * its Kind; absent optional parts are omitted.
 */
public class AstJson implements StmtVisitor<JSONObject>,
                                ExprVisitor<JSONObject> {

    public static final AstJson INSTANCE = new AstJson();

    protected JSONObject node(Node n) {
        JSONObject ret = new JSONObject();
        ret.put("kind", n.getKind().getTypeName());
        return ret;
    }

    protected JSONObject expr(Expr e) {
        return (e == null) ? null : e.accept(this);
    }

    protected JSONArray stmts(List<Stmt> items) {
        if (items == null) return null;
        JSONArray ret = new JSONArray();
        for (Stmt s : items) ret.put(s.accept(this));
        return ret;
    }

    protected JSONArray exprs(List<Expr> items) {
        JSONArray ret = new JSONArray();
        for (Expr e : items) ret.put(e.accept(this));
        return ret;
    }

    public JSONObject visitProgram(Program node) {
        return node(node).put("body", stmts(node.getBody()));
    }

    public JSONObject visitVarDeclaration(VarDeclaration node) {
        return node(node).put("constant", node.isConstant())
            .put("identifier", node.getIdentifier())
            .putOpt("value", expr(node.getValue()));
    }

    public JSONObject visitFunctionDeclaration(FunctionDeclaration node) {
        return node(node).put("name", node.getName())
            .put("parameters", new JSONArray(node.getParameters()))
            .put("body", stmts(node.getBody()));
    }

    public JSONObject visitIfStatement(IfStatement node) {
        return node(node).put("condition", expr(node.getCondition()))
            .put("then", stmts(node.getThen()))
            .putOpt("else", stmts(node.getElse()));
    }

    public JSONObject visitWhileStatement(WhileStatement node) {
        return node(node).put("condition", expr(node.getCondition()))
            .put("body", stmts(node.getBody()));
    }

    public JSONObject visitForStatement(ForStatement node) {
        Stmt init = node.getInit();
        return node(node)
            .putOpt("init", (init == null) ? null : init.accept(this))
            .putOpt("condition", expr(node.getCondition()))
            .putOpt("update", expr(node.getUpdate()))
            .put("body", stmts(node.getBody()));
    }

    public JSONObject visitReturnStatement(ReturnStatement node) {
        return node(node).putOpt("value", expr(node.getValue()));
    }

    public JSONObject visitBreakStatement(BreakStatement node) {
        return node(node);
    }

    public JSONObject visitContinueStatement(ContinueStatement node) {
        return node(node);
    }

    public JSONObject visitExpressionStatement(ExpressionStatement node) {
        return node(node).put("expression", expr(node.getExpression()));
    }

    public JSONObject visitAssignmentExpr(AssignmentExpr node) {
        return node(node).put("assignee", expr(node.getAssignee()))
            .put("value", expr(node.getValue()));
    }

    public JSONObject visitBinaryExpr(BinaryExpr node) {
        return node(node).put("left", expr(node.getLeft()))
            .put("operator", node.getOperator())
            .put("right", expr(node.getRight()));
    }

    public JSONObject visitUnaryExpr(UnaryExpr node) {
        return node(node).put("operator", node.getOperator())
            .put("argument", expr(node.getArgument()));
    }

    public JSONObject visitCallExpr(CallExpr node) {
        return node(node).put("caller", expr(node.getCaller()))
            .put("args", exprs(node.getArgs()));
    }

    public JSONObject visitMemberExpr(MemberExpr node) {
        return node(node).put("object", expr(node.getObject()))
            .put("property", expr(node.getProperty()))
            .put("computed", node.isComputed());
    }

    public JSONObject visitIdentifier(Identifier node) {
        return node(node).put("symbol", node.getSymbol());
    }

    public JSONObject visitNumericLiteral(NumericLiteral node) {
        return node(node).put("value", node.getValue());
    }

    public JSONObject visitStringLiteral(StringLiteral node) {
        return node(node).put("value", node.getValue());
    }

    public JSONObject visitArrayLiteral(ArrayLiteral node) {
        return node(node).put("elements", exprs(node.getElements()));
    }

    public JSONObject visitObjectLiteral(ObjectLiteral node) {
        JSONArray props = new JSONArray();
        for (Property p : node.getProperties()) props.put(property(p));
        return node(node).put("properties", props);
    }

    public JSONObject property(Property node) {
        return node(node).put("key", node.getKey())
            .putOpt("value", expr(node.getValue()));
    }

    public static JSONObject toJSON(Node node) {
        if (node instanceof Stmt) {
            return ((Stmt) node).accept(INSTANCE);
        } else if (node instanceof Expr) {
            return ((Expr) node).accept(INSTANCE);
        } else if (node instanceof Property) {
            return INSTANCE.property((Property) node);
        } else {
            throw new IllegalArgumentException("Cannot render node " +
                "kind " + node.getKind());
        }
    }

}
