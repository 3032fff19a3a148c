package net.llparse.lang;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import net.llparse.api.parser.Mapper;
import net.llparse.api.parser.Mappers;
import net.llparse.api.parser.MappingException;
import net.llparse.api.parser.Parser;
import net.llparse.api.parser.RecordMapper;
import net.llparse.api.parser.TransformMapper;
import net.llparse.api.parser.UnionMapper;
import net.llparse.ast.ArrayLiteral;
import net.llparse.ast.AssignmentExpr;
import net.llparse.ast.BinaryExpr;
import net.llparse.ast.BreakStatement;
import net.llparse.ast.CallExpr;
import net.llparse.ast.ContinueStatement;
import net.llparse.ast.Expr;
import net.llparse.ast.ExpressionStatement;
import net.llparse.ast.ForStatement;
import net.llparse.ast.FunctionDeclaration;
import net.llparse.ast.Identifier;
import net.llparse.ast.IfStatement;
import net.llparse.ast.MemberExpr;
import net.llparse.ast.NumericLiteral;
import net.llparse.ast.ObjectLiteral;
import net.llparse.ast.Program;
import net.llparse.ast.Property;
import net.llparse.ast.ReturnStatement;
import net.llparse.ast.Stmt;
import net.llparse.ast.StringLiteral;
import net.llparse.ast.UnaryExpr;
import net.llparse.ast.VarDeclaration;
import net.llparse.ast.WhileStatement;

/**
 * Converts parse trees of the language grammar into ASTs.
 */
public class AstMapper implements Mapper<Program> {

    /* One level of binary operators, e.g. "AddExpr -> MultExpr AddRest;
     * AddRest -> addop MultExpr AddRest | ε". The operands are folded to
     * the left. */
    protected static class BinaryChainMapper extends RecordMapper<Expr> {

        private final String operandName;
        private final String restName;
        private final String operatorName;
        private final Mapper<Expr> operand;

        public BinaryChainMapper(String operandName, String restName,
                                 String operatorName, Mapper<Expr> operand) {
            this.operandName = operandName;
            this.restName = restName;
            this.operatorName = operatorName;
            this.operand = operand;
        }

        protected Expr mapInner(Provider p) throws MappingException {
            Expr ret = p.mapNext(operandName, operand);
            Parser.ParseTree rest = p.expect(restName);
            while (! rest.getChildren().isEmpty()) {
                Provider rp = new Provider(rest);
                String op = rp.content(operatorName);
                Expr right = rp.mapNext(operandName, operand);
                Parser.ParseTree next = rp.expect(restName);
                if (rp.hasNext())
                    throw new MappingException("Parse tree " +
                        rest.getName() + " has unexpected child " +
                        rp.peekName());
                ret = new BinaryExpr(ret, op, right);
                rest = next;
            }
            return ret;
        }

    }

    private final Mapper<Expr> expr = new Mapper<Expr>() {
        public Expr map(Parser.ParseTree pt) throws MappingException {
            return exprInner.map(pt);
        }
    };

    private final Mapper<List<Stmt>> stmtList;
    private final Mapper<Program> program;
    // Assigned after the mappers referring to them have been created.
    private Mapper<Stmt> stmt;
    private Mapper<Stmt> ifStmt;
    private Mapper<Expr> exprInner;
    private Mapper<Expr> assignExpr;
    private Mapper<Expr> unaryExpr;
    private Mapper<Expr> primaryExpr;

    public AstMapper() {
        final Mapper<String> content = Mappers.content();
        final Mapper<Stmt> stmtRef = new Mapper<Stmt>() {
            public Stmt map(Parser.ParseTree pt) throws MappingException {
                return stmt.map(pt);
            }
        };
        stmtList = Mappers.flatten(stmtRef, "StmtList", null);

        final Mapper<List<Stmt>> block = new RecordMapper<List<Stmt>>() {
            protected List<Stmt> mapInner(Provider p)
                    throws MappingException {
                p.expect("{");
                List<Stmt> ret = p.mapNext("StmtList", stmtList);
                p.expect("}");
                return ret;
            }
        };
        // ForCond, ForUpdate, ReturnValue
        final Mapper<Expr> optionalExpr = new RecordMapper<Expr>() {
            protected Expr mapInner(Provider p) throws MappingException {
                if (! p.hasNext()) return null;
                return p.mapNext("Expr", expr);
            }
        };

        final Mapper<Stmt> varDecl = new RecordMapper<Stmt>() {
            protected Stmt mapInner(Provider p) throws MappingException {
                if (p.isNext("const")) {
                    p.expect("const");
                    String name = p.content("identifier");
                    p.expect("=");
                    Expr value = p.mapNext("Expr", expr);
                    p.expect(";");
                    return new VarDeclaration(true, name, value);
                }
                p.expect("let");
                String name = p.content("identifier");
                Parser.ParseTree init = p.expect("VarInit");
                p.expect(";");
                Expr value = null;
                if (! init.getChildren().isEmpty()) {
                    Provider ip = new Provider(init);
                    ip.expect("=");
                    value = ip.mapNext("Expr", expr);
                }
                return new VarDeclaration(false, name, value);
            }
        };
        final Mapper<List<String>> params = Mappers.flatten(content,
            "ParamRest", ",");
        Mapper<Stmt> fnDecl = new RecordMapper<Stmt>() {
            protected Stmt mapInner(Provider p) throws MappingException {
                p.expect("fn");
                String name = p.content("identifier");
                p.expect("(");
                List<String> ps = p.mapNext("Params", params);
                p.expect(")");
                p.expect("{");
                List<Stmt> body = p.mapNext("StmtList", stmtList);
                p.expect("}");
                return new FunctionDeclaration(name, ps, body);
            }
        };
        final Mapper<List<Stmt>> elseClause =
                new RecordMapper<List<Stmt>>() {
            protected List<Stmt> mapInner(Provider p)
                    throws MappingException {
                if (! p.hasNext()) return null;
                p.expect("else");
                Parser.ParseTree body = p.expect("ElseBody");
                Provider bp = new Provider(body);
                if (bp.isNext("IfStmt"))
                    return Collections.singletonList(
                        bp.mapNext("IfStmt", ifStmt));
                return block.map(body);
            }
        };
        ifStmt = new RecordMapper<Stmt>() {
            protected Stmt mapInner(Provider p) throws MappingException {
                p.expect("if");
                p.expect("(");
                Expr cond = p.mapNext("Expr", expr);
                p.expect(")");
                p.expect("{");
                List<Stmt> body = p.mapNext("StmtList", stmtList);
                p.expect("}");
                List<Stmt> alt = p.mapNext("ElseClause", elseClause);
                return new IfStatement(cond, body, alt);
            }
        };
        Mapper<Stmt> whileStmt = new RecordMapper<Stmt>() {
            protected Stmt mapInner(Provider p) throws MappingException {
                p.expect("while");
                p.expect("(");
                Expr cond = p.mapNext("Expr", expr);
                p.expect(")");
                p.expect("{");
                List<Stmt> body = p.mapNext("StmtList", stmtList);
                p.expect("}");
                return new WhileStatement(cond, body);
            }
        };
        final Mapper<Stmt> exprStmt = new RecordMapper<Stmt>() {
            protected Stmt mapInner(Provider p) throws MappingException {
                Expr e = p.mapNext("Expr", expr);
                p.expect(";");
                return new ExpressionStatement(e);
            }
        };
        final Mapper<Stmt> forInit = Mappers.unwrap(
            new UnionMapper<Stmt>("for loop initializer")
                .add("VarDecl", varDecl)
                .add("ExprStmt", exprStmt)
                .add(";", Mappers.<Stmt>constant(null)));
        Mapper<Stmt> forStmt = new RecordMapper<Stmt>() {
            protected Stmt mapInner(Provider p) throws MappingException {
                p.expect("for");
                p.expect("(");
                Stmt init = p.mapNext("ForInit", forInit);
                Expr cond = p.mapNext("ForCond", optionalExpr);
                p.expect(";");
                Expr update = p.mapNext("ForUpdate", optionalExpr);
                p.expect(")");
                p.expect("{");
                List<Stmt> body = p.mapNext("StmtList", stmtList);
                p.expect("}");
                return new ForStatement(init, cond, update, body);
            }
        };
        Mapper<Stmt> returnStmt = new RecordMapper<Stmt>() {
            protected Stmt mapInner(Provider p) throws MappingException {
                p.expect("return");
                Expr value = p.mapNext("ReturnValue", optionalExpr);
                p.expect(";");
                return new ReturnStatement(value);
            }
        };
        Mapper<Stmt> breakStmt = new RecordMapper<Stmt>() {
            protected Stmt mapInner(Provider p) throws MappingException {
                p.expect("break");
                p.expect(";");
                return new BreakStatement();
            }
        };
        Mapper<Stmt> continueStmt = new RecordMapper<Stmt>() {
            protected Stmt mapInner(Provider p) throws MappingException {
                p.expect("continue");
                p.expect(";");
                return new ContinueStatement();
            }
        };
        stmt = Mappers.unwrap(new UnionMapper<Stmt>("statement")
            .add("VarDecl", varDecl)
            .add("FnDecl", fnDecl)
            .add("IfStmt", ifStmt)
            .add("WhileStmt", whileStmt)
            .add("ForStmt", forStmt)
            .add("ReturnStmt", returnStmt)
            .add("BreakStmt", breakStmt)
            .add("ContinueStmt", continueStmt)
            .add("ExprStmt", exprStmt));

        exprInner = Mappers.unwrap(new Mapper<Expr>() {
            public Expr map(Parser.ParseTree pt) throws MappingException {
                if (! pt.getName().equals("AssignExpr"))
                    throw new MappingException("Cannot map " +
                        pt.getName() + " as expression");
                return assignExpr.map(pt);
            }
        });
        final Mapper<Expr> unaryRef = new Mapper<Expr>() {
            public Expr map(Parser.ParseTree pt) throws MappingException {
                return unaryExpr.map(pt);
            }
        };
        final Mapper<Expr> multExpr = new BinaryChainMapper("UnaryExpr",
            "MultRest", LanguageTerminals.T_MULOP, unaryRef);
        final Mapper<Expr> addExpr = new BinaryChainMapper("MultExpr",
            "AddRest", LanguageTerminals.T_ADDOP, multExpr);
        final Mapper<Expr> compExpr = new BinaryChainMapper("AddExpr",
            "CompRest", LanguageTerminals.T_RELOP, addExpr);
        assignExpr = new RecordMapper<Expr>() {
            protected Expr mapInner(Provider p) throws MappingException {
                Expr target = p.mapNext("CompExpr", compExpr);
                Parser.ParseTree rest = p.expect("AssignRest");
                if (rest.getChildren().isEmpty()) return target;
                Provider rp = new Provider(rest);
                rp.expect("=");
                // Right-associative: a = b = c is a = (b = c).
                Expr value = rp.mapNext("AssignExpr", assignExpr);
                if (rp.hasNext())
                    throw new MappingException("Parse tree AssignRest " +
                        "has unexpected child " + rp.peekName());
                return new AssignmentExpr(target, value);
            }
        };

        final Mapper<List<Expr>> args = Mappers.flatten(expr, "ArgRest",
                                                        ",");
        final Mapper<Expr> postfixExpr = new RecordMapper<Expr>() {
            protected Expr mapInner(Provider p) throws MappingException {
                Expr ret = p.mapNext("PrimaryExpr", primaryExpr);
                Parser.ParseTree tail = p.expect("PostfixTail");
                while (! tail.getChildren().isEmpty()) {
                    Provider tp = new Provider(tail);
                    if (tp.isNext(".")) {
                        tp.expect(".");
                        ret = new MemberExpr(ret,
                            new Identifier(tp.content("identifier")),
                            false);
                    } else if (tp.isNext("[")) {
                        tp.expect("[");
                        ret = new MemberExpr(ret, tp.mapNext("Expr", expr),
                                             true);
                        tp.expect("]");
                    } else {
                        tp.expect("(");
                        ret = new CallExpr(ret, tp.mapNext("Args", args));
                        tp.expect(")");
                    }
                    tail = tp.expect("PostfixTail");
                }
                return ret;
            }
        };
        unaryExpr = new RecordMapper<Expr>() {
            protected Expr mapInner(Provider p) throws MappingException {
                if (p.isNext("PostfixExpr"))
                    return p.mapNext("PostfixExpr", postfixExpr);
                String op = p.isNext(LanguageTerminals.T_UNOP) ?
                    p.content(LanguageTerminals.T_UNOP) :
                    p.content(LanguageTerminals.T_ADDOP);
                return new UnaryExpr(op, p.mapNext("UnaryExpr", unaryExpr));
            }
        };

        final Mapper<Property> prop = new RecordMapper<Property>() {
            protected Property mapInner(Provider p)
                    throws MappingException {
                String key = p.content("identifier");
                Parser.ParseTree value = p.expect("PropValue");
                if (value.getChildren().isEmpty())
                    return new Property(key, null);
                Provider vp = new Provider(value);
                vp.expect(":");
                return new Property(key, vp.mapNext("Expr", expr));
            }
        };
        final Mapper<List<Property>> props = Mappers.flatten(prop,
            new HashSet<String>(Arrays.asList("PropRest", "Props")),
            Collections.singleton(","));
        Mapper<Expr> objLiteral = new RecordMapper<Expr>() {
            protected Expr mapInner(Provider p) throws MappingException {
                p.expect("{");
                List<Property> ps = p.mapNext("Props", props);
                p.expect("}");
                return new ObjectLiteral(ps);
            }
        };
        final Mapper<List<Expr>> elements = Mappers.flatten(expr,
            new HashSet<String>(Arrays.asList("ElementRest", "Elements")),
            Collections.singleton(","));
        Mapper<Expr> arrayLiteral = new RecordMapper<Expr>() {
            protected Expr mapInner(Provider p) throws MappingException {
                p.expect("[");
                List<Expr> es = p.mapNext("Elements", elements);
                p.expect("]");
                return new ArrayLiteral(es);
            }
        };
        final Mapper<Expr> parenthesized = new RecordMapper<Expr>() {
            protected Expr mapInner(Provider p) throws MappingException {
                p.expect("(");
                Expr ret = p.mapNext("Expr", expr);
                p.expect(")");
                return ret;
            }
        };
        final UnionMapper<Expr> atoms = new UnionMapper<Expr>("primary " +
                                                              "expression")
            .add("identifier", new TransformMapper<String, Expr>(content) {
                protected Expr transform(String value) {
                    return new Identifier(value);
                }
            })
            .add("number", new TransformMapper<String, Expr>(content) {
                protected Expr transform(String value) {
                    return new NumericLiteral(Double.parseDouble(value));
                }
            })
            .add("string", new TransformMapper<String, Expr>(content) {
                protected Expr transform(String value) {
                    return new StringLiteral(value);
                }
            })
            .add("ObjLiteral", objLiteral)
            .add("ArrayLiteral", arrayLiteral);
        final Mapper<Expr> atom = Mappers.unwrap(atoms);
        primaryExpr = new Mapper<Expr>() {
            public Expr map(Parser.ParseTree pt) throws MappingException {
                List<Parser.ParseTree> children = pt.getChildren();
                if (! children.isEmpty() &&
                        children.get(0).getName().equals("("))
                    return parenthesized.map(pt);
                return atom.map(pt);
            }
        };

        program = new RecordMapper<Program>() {
            protected Program mapInner(Provider p) throws MappingException {
                return new Program(p.mapNext("StmtList", stmtList));
            }
        };
    }

    public Program map(Parser.ParseTree pt) throws MappingException {
        if (! pt.getName().equals(LanguageGrammar.START))
            throw new MappingException("Cannot map " + pt.getName() +
                " as program");
        return program.map(pt);
    }

}
