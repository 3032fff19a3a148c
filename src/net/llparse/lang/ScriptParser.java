package net.llparse.lang;

import java.util.List;
import java.util.logging.Logger;
import net.llparse.api.parser.GrammarConflictException;
import net.llparse.api.parser.InvalidGrammarException;
import net.llparse.api.parser.MappingException;
import net.llparse.api.parser.Parser;
import net.llparse.api.parser.ParserException;
import net.llparse.api.parser.ParsingException;
import net.llparse.api.parser.Token;
import net.llparse.ast.Program;
import net.llparse.util.parser.Analyzer;
import net.llparse.util.parser.GrammarAnalysis;
import net.llparse.util.parser.ParserSettings;
import net.llparse.util.parser.PredictiveParser;

/**
 * The table-driven parser of the scripting language.
 * Instances are immutable and may be shared; the shared default instance
 * (see getDefault()) analyzes the language grammar once per JVM.
 */
public class ScriptParser {

    private static class Holder {

        static final ScriptParser INSTANCE = createDefault();

    }

    private static final Logger LOGGER = Logger.getLogger("ScriptParser");

    private final PredictiveParser parser;
    private final AstMapper mapper;

    public ScriptParser(ParserSettings settings)
            throws InvalidGrammarException, GrammarConflictException {
        GrammarAnalysis analysis = Analyzer.analyze(LanguageGrammar.create());
        parser = new PredictiveParser(analysis, LanguageTerminals.INSTANCE,
                                      settings.createTraceListener());
        mapper = new AstMapper();
        LOGGER.info("Compiled language grammar (" +
            analysis.getGrammar().getProductions().size() +
            " productions, " + analysis.getGrammar().getNonterminals().size() +
            " nonterminals)");
    }

    public GrammarAnalysis getAnalysis() {
        return parser.getAnalysis();
    }

    public PredictiveParser getParser() {
        return parser;
    }

    public AstMapper getMapper() {
        return mapper;
    }

    public Parser.ParseTree parseTree(List<? extends Token> tokens)
            throws ParsingException {
        return parser.parse(tokens);
    }

    /**
     * Parse the given tokens into an AST.
     * Syntax errors surface as ParsingException, parse trees the converter
     * cannot handle as MappingException; both are ParserExceptions, which
     * allows callers to fall back to another parser on any failure.
     */
    public Program parse(List<? extends Token> tokens)
            throws ParsingException, MappingException {
        return mapper.map(parser.parse(tokens));
    }

    public static ScriptParser getDefault() {
        return Holder.INSTANCE;
    }

    public static Program parseProgram(List<? extends Token> tokens)
            throws ParsingException, MappingException {
        return getDefault().parse(tokens);
    }

    private static ScriptParser createDefault() {
        try {
            return new ScriptParser(new ParserSettings());
        } catch (ParserException exc) {
            throw new IllegalStateException("Language grammar is not " +
                "usable", exc);
        }
    }

}
