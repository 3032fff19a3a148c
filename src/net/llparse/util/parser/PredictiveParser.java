package net.llparse.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.llparse.api.parser.GrammarConflictException;
import net.llparse.api.parser.InvalidGrammarException;
import net.llparse.api.parser.Parser;
import net.llparse.api.parser.ParsingException;
import net.llparse.api.parser.TerminalMapper;
import net.llparse.api.parser.Token;

public class PredictiveParser implements Parser {

    protected class Run {

        private final List<? extends Token> tokens;
        private final List<Symbol> symbolStack;
        private final List<Symbol> symbolStackView;
        private final List<ParseTreeImpl> nodeStack;
        private final ParseTreeImpl root;
        private int position;

        public Run(List<? extends Token> tokens) {
            this.tokens = tokens;
            this.symbolStack = new ArrayList<Symbol>();
            this.symbolStackView = Collections.unmodifiableList(symbolStack);
            this.nodeStack = new ArrayList<ParseTreeImpl>();
            Nonterminal start = getGrammar().getStartSymbol();
            this.root = new ParseTreeImpl(start);
            symbolStack.add(Terminal.END_MARKER);
            nodeStack.add(null);
            symbolStack.add(start);
            nodeStack.add(root);
        }

        public int getPosition() {
            return position;
        }

        public List<Symbol> getStack() {
            return symbolStackView;
        }

        protected Token currentToken() throws ParsingException {
            if (position >= tokens.size())
                throw new ParsingException(position,
                    "Premature end of input at position " + position);
            return tokens.get(position);
        }

        /* Operator tokens whose own terminal is not declared are read as
         * the grammar's operator class, if it has one. */
        protected Terminal currentTerminal(Token tok)
                throws ParsingException {
            String name = mapper.terminalFor(tok);
            Terminal ret = (name == null) ? null :
                getGrammar().getTerminal(name);
            if (ret == null && mapper.isOperator(tok))
                ret = getGrammar().getOperatorClass();
            if (ret == null)
                throw new ParsingException(position, "Unknown terminal " +
                    name + " for token '" + tok.getContent() +
                    "' at position " + position);
            return ret;
        }

        protected void pop() {
            symbolStack.remove(symbolStack.size() - 1);
            nodeStack.remove(nodeStack.size() - 1);
        }

        protected void match(Terminal top, Terminal term, Token tok)
                throws ParsingException {
            if (! matches(top, term, tok)) {
                if (term.isEndMarker())
                    throw new ParsingException(position,
                        "Unexpected end of input at position " +
                        position + ", expected " + top);
                throw new ParsingException(position, "Expected " + top +
                    ", found " + term + " '" + tok.getContent() +
                    "' at position " + position);
            }
            nodeStack.get(nodeStack.size() - 1).setToken(tok);
            pop();
            listener.match(top, tok, position);
            position++;
        }

        protected void expand(Nonterminal top, Terminal term, Token tok)
                throws ParsingException {
            Production prod = lookup(top, term, tok);
            if (prod == null)
                throw new ParsingException(position, "No production for (" +
                    top + ", " + term + ") at position " + position);
            ParseTreeImpl node = nodeStack.get(nodeStack.size() - 1);
            pop();
            List<Symbol> rhs = prod.getRHS();
            List<ParseTreeImpl> created = new ArrayList<ParseTreeImpl>();
            for (Symbol sym : rhs) {
                if (Terminal.EPSILON.equals(sym)) continue;
                ParseTreeImpl child = new ParseTreeImpl(sym);
                node.addChild(child);
                created.add(child);
            }
            for (int i = rhs.size() - 1, j = created.size() - 1; i >= 0;
                    i--) {
                Symbol sym = rhs.get(i);
                if (Terminal.EPSILON.equals(sym)) continue;
                symbolStack.add(sym);
                nodeStack.add(created.get(j--));
            }
            listener.expand(prod, position);
        }

        /* Nothing may follow the end marker that completed the parse. */
        protected void checkExhausted() throws ParsingException {
            int next = position + 1;
            if (next >= tokens.size()) return;
            Token extra = tokens.get(next);
            throw new ParsingException(next, "Unexpected trailing input " +
                "at position " + next + " after end of input: '" +
                extra.getContent() + "'");
        }

        protected ParseTree parseInner() throws ParsingException {
            for (;;) {
                Token tok = currentToken();
                Terminal term = currentTerminal(tok);
                Symbol top = symbolStack.get(symbolStack.size() - 1);
                listener.step(symbolStackView, tok, term, position);
                if (Terminal.END_MARKER.equals(top)) {
                    if (! term.isEndMarker())
                        throw new ParsingException(position,
                            "Unexpected trailing input at position " +
                            position + ": " + term + " '" +
                            tok.getContent() + "'");
                    checkExhausted();
                    listener.accept(position);
                    return root;
                } else if (top.isTerminal()) {
                    match((Terminal) top, term, tok);
                } else {
                    expand((Nonterminal) top, term, tok);
                }
            }
        }

        public ParseTree parse() throws ParsingException {
            try {
                return parseInner();
            } catch (ParsingException exc) {
                listener.reject(exc);
                throw exc;
            }
        }

    }

    private final GrammarAnalysis analysis;
    private final TerminalMapper mapper;
    private final TraceListener listener;

    public PredictiveParser(GrammarAnalysis analysis, TerminalMapper mapper,
            TraceListener listener) throws GrammarConflictException {
        if (analysis == null)
            throw new NullPointerException("Analysis may not be null");
        if (mapper == null)
            throw new NullPointerException("Terminal mapper may not be null");
        if (! analysis.isLL1())
            throw new GrammarConflictException(analysis.getConflicts());
        this.analysis = analysis;
        this.mapper = mapper;
        this.listener = (listener == null) ? TraceListener.NULL : listener;
    }
    public PredictiveParser(GrammarAnalysis analysis, TerminalMapper mapper)
            throws GrammarConflictException {
        this(analysis, mapper, null);
    }

    public GrammarAnalysis getAnalysis() {
        return analysis;
    }

    public Grammar getGrammar() {
        return analysis.getGrammar();
    }

    public TerminalMapper getMapper() {
        return mapper;
    }

    public TraceListener getListener() {
        return listener;
    }

    /* Whether a token mapped to term can be matched against the terminal
     * top; the grammar's operator class matches any operator token. */
    protected boolean matches(Terminal top, Terminal term, Token tok) {
        if (top.equals(term)) return true;
        Terminal opClass = getGrammar().getOperatorClass();
        return (opClass != null && top.equals(opClass) &&
                mapper.isOperator(tok));
    }

    protected Production lookup(Nonterminal top, Terminal term, Token tok) {
        ParseTable table = analysis.getTable();
        Production ret = table.get(top, term);
        if (ret != null) return ret;
        Terminal opClass = getGrammar().getOperatorClass();
        if (opClass != null && mapper.isOperator(tok))
            ret = table.get(top, opClass);
        return ret;
    }

    public ParseTree parse(List<? extends Token> tokens)
            throws ParsingException {
        if (tokens == null)
            throw new NullPointerException("Token list may not be null");
        return new Run(tokens).parse();
    }

    public static PredictiveParser compile(Grammar grammar,
            TerminalMapper mapper, TraceListener listener)
            throws InvalidGrammarException, GrammarConflictException {
        return new PredictiveParser(Analyzer.analyze(grammar), mapper,
                                    listener);
    }
    public static PredictiveParser compile(Grammar grammar,
            TerminalMapper mapper)
            throws InvalidGrammarException, GrammarConflictException {
        return compile(grammar, mapper, null);
    }

}
