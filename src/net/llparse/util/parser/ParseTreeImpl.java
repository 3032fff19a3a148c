package net.llparse.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.llparse.api.parser.Parser;
import net.llparse.api.parser.Token;

public class ParseTreeImpl implements Parser.ParseTree {

    private final String name;
    private final boolean terminal;
    private final List<Parser.ParseTree> children;
    private final List<Parser.ParseTree> childrenView;
    private Token token;

    {
        children = new ArrayList<Parser.ParseTree>();
        childrenView = Collections.unmodifiableList(children);
    }

    public ParseTreeImpl(Symbol sym) {
        this.name = sym.getName();
        this.terminal = sym.isTerminal();
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }

    private void appendTo(StringBuilder sb) {
        sb.append(name);
        if (token != null) {
            sb.append('<').append(token.getContent()).append('>');
        }
        if (children.isEmpty()) return;
        sb.append('(');
        boolean first = true;
        for (Parser.ParseTree ch : children) {
            if (first) {
                first = false;
            } else {
                sb.append(' ');
            }
            if (ch instanceof ParseTreeImpl) {
                ((ParseTreeImpl) ch).appendTo(sb);
            } else {
                sb.append(ch);
            }
        }
        sb.append(')');
    }

    public String getName() {
        return name;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public Token getToken() {
        return token;
    }
    public void setToken(Token tok) {
        if (! terminal)
            throw new IllegalStateException("Cannot attach token to " +
                "nonterminal node " + name);
        token = tok;
    }

    public String getContent() {
        return (token == null) ? null : token.getContent();
    }

    public List<Parser.ParseTree> getChildren() {
        return childrenView;
    }

    public void addChild(Parser.ParseTree ch) {
        if (terminal)
            throw new IllegalStateException("Cannot add children to " +
                "terminal node " + name);
        children.add(ch);
    }

}
