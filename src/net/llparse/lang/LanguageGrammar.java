package net.llparse.lang;

import net.llparse.util.parser.Grammar;

/**
 * The LL(1) grammar of the scripting language.
 * Binary operator levels are expressed as "X -> Y XRest; XRest -> op Y
 * XRest | ε", i.e. right-recursively; AstMapper re-associates them to the
 * left. Operator tokens are told apart by precedence level (see
 * LanguageTerminals) so that every level has its own lookahead terminal.
 */
public final class LanguageGrammar {

    public static final String START = "Program";

    private static final String[] TERMINALS = {
        "let", "const", "fn", "if", "else", "while", "for", "return",
        "break", "continue", "identifier", "number", "string", "=", ";",
        "(", ")", "{", "}", "[", "]", ",", ":", ".",
        LanguageTerminals.T_ADDOP, LanguageTerminals.T_MULOP,
        LanguageTerminals.T_RELOP, LanguageTerminals.T_UNOP
    };

    private static final String[] NONTERMINALS = {
        "Program", "StmtList", "Stmt", "VarDecl", "VarInit", "FnDecl",
        "Params", "ParamRest", "IfStmt", "ElseClause", "ElseBody",
        "WhileStmt", "ForStmt", "ForInit", "ForCond", "ForUpdate",
        "ReturnStmt", "ReturnValue", "BreakStmt", "ContinueStmt",
        "ExprStmt", "Expr", "AssignExpr", "AssignRest", "CompExpr",
        "CompRest", "AddExpr", "AddRest", "MultExpr", "MultRest",
        "UnaryExpr", "PostfixExpr", "PostfixTail", "PrimaryExpr", "Args",
        "ArgRest", "ObjLiteral", "Props", "PropRest", "Prop", "PropValue",
        "ArrayLiteral", "Elements", "ElementRest"
    };

    private LanguageGrammar() {}

    public static Grammar create() {
        Grammar g = new Grammar();
        g.addTerminals(TERMINALS);
        g.addNonterminals(NONTERMINALS);
        g.setStartSymbol(START);

        g.addProduction("Program", "StmtList");
        g.addProduction("StmtList", "Stmt", "StmtList");
        g.addProduction("StmtList");
        g.addProduction("Stmt", "VarDecl");
        g.addProduction("Stmt", "FnDecl");
        g.addProduction("Stmt", "IfStmt");
        g.addProduction("Stmt", "WhileStmt");
        g.addProduction("Stmt", "ForStmt");
        g.addProduction("Stmt", "ReturnStmt");
        g.addProduction("Stmt", "BreakStmt");
        g.addProduction("Stmt", "ContinueStmt");
        g.addProduction("Stmt", "ExprStmt");

        // Declarations
        g.addProduction("VarDecl", "let", "identifier", "VarInit", ";");
        g.addProduction("VarDecl", "const", "identifier", "=", "Expr", ";");
        g.addProduction("VarInit", "=", "Expr");
        g.addProduction("VarInit");
        g.addProduction("FnDecl", "fn", "identifier", "(", "Params", ")",
                        "{", "StmtList", "}");
        g.addProduction("Params", "identifier", "ParamRest");
        g.addProduction("Params");
        g.addProduction("ParamRest", ",", "identifier", "ParamRest");
        g.addProduction("ParamRest");

        // Control flow
        g.addProduction("IfStmt", "if", "(", "Expr", ")", "{", "StmtList",
                        "}", "ElseClause");
        g.addProduction("ElseClause", "else", "ElseBody");
        g.addProduction("ElseClause");
        g.addProduction("ElseBody", "{", "StmtList", "}");
        g.addProduction("ElseBody", "IfStmt");
        g.addProduction("WhileStmt", "while", "(", "Expr", ")", "{",
                        "StmtList", "}");
        g.addProduction("ForStmt", "for", "(", "ForInit", "ForCond", ";",
                        "ForUpdate", ")", "{", "StmtList", "}");
        g.addProduction("ForInit", "VarDecl");
        g.addProduction("ForInit", "ExprStmt");
        g.addProduction("ForInit", ";");
        g.addProduction("ForCond", "Expr");
        g.addProduction("ForCond");
        g.addProduction("ForUpdate", "Expr");
        g.addProduction("ForUpdate");
        g.addProduction("ReturnStmt", "return", "ReturnValue", ";");
        g.addProduction("ReturnValue", "Expr");
        g.addProduction("ReturnValue");
        g.addProduction("BreakStmt", "break", ";");
        g.addProduction("ContinueStmt", "continue", ";");
        g.addProduction("ExprStmt", "Expr", ";");

        // Expressions, from lowest to highest precedence
        g.addProduction("Expr", "AssignExpr");
        g.addProduction("AssignExpr", "CompExpr", "AssignRest");
        g.addProduction("AssignRest", "=", "AssignExpr");
        g.addProduction("AssignRest");
        g.addProduction("CompExpr", "AddExpr", "CompRest");
        g.addProduction("CompRest", LanguageTerminals.T_RELOP, "AddExpr",
                        "CompRest");
        g.addProduction("CompRest");
        g.addProduction("AddExpr", "MultExpr", "AddRest");
        g.addProduction("AddRest", LanguageTerminals.T_ADDOP, "MultExpr",
                        "AddRest");
        g.addProduction("AddRest");
        g.addProduction("MultExpr", "UnaryExpr", "MultRest");
        g.addProduction("MultRest", LanguageTerminals.T_MULOP, "UnaryExpr",
                        "MultRest");
        g.addProduction("MultRest");
        g.addProduction("UnaryExpr", LanguageTerminals.T_UNOP, "UnaryExpr");
        g.addProduction("UnaryExpr", LanguageTerminals.T_ADDOP,
                        "UnaryExpr");
        g.addProduction("UnaryExpr", "PostfixExpr");
        g.addProduction("PostfixExpr", "PrimaryExpr", "PostfixTail");
        g.addProduction("PostfixTail", ".", "identifier", "PostfixTail");
        g.addProduction("PostfixTail", "[", "Expr", "]", "PostfixTail");
        g.addProduction("PostfixTail", "(", "Args", ")", "PostfixTail");
        g.addProduction("PostfixTail");
        g.addProduction("PrimaryExpr", "identifier");
        g.addProduction("PrimaryExpr", "number");
        g.addProduction("PrimaryExpr", "string");
        g.addProduction("PrimaryExpr", "(", "Expr", ")");
        g.addProduction("PrimaryExpr", "ObjLiteral");
        g.addProduction("PrimaryExpr", "ArrayLiteral");
        g.addProduction("Args", "Expr", "ArgRest");
        g.addProduction("Args");
        g.addProduction("ArgRest", ",", "Expr", "ArgRest");
        g.addProduction("ArgRest");

        // Literals
        g.addProduction("ObjLiteral", "{", "Props", "}");
        g.addProduction("Props", "Prop", "PropRest");
        g.addProduction("Props");
        g.addProduction("PropRest", ",", "Props");
        g.addProduction("PropRest");
        g.addProduction("Prop", "identifier", "PropValue");
        g.addProduction("PropValue", ":", "Expr");
        g.addProduction("PropValue");
        g.addProduction("ArrayLiteral", "[", "Elements", "]");
        g.addProduction("Elements", "Expr", "ElementRest");
        g.addProduction("Elements");
        g.addProduction("ElementRest", ",", "Elements");
        g.addProduction("ElementRest");
        return g;
    }

}
