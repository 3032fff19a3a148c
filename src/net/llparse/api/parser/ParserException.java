package net.llparse.api.parser;

/**
 * Root of the checked exceptions raised by grammar analysis, parser
 * construction, parsing, and parse tree conversion.
 * Callers that only need to know whether some input could be handled (e.g.
 * to fall back to a different parser) can catch this; the subclasses tell
 * grammar errors (InvalidGrammarException, GrammarConflictException) from
 * input errors (ParsingException, MappingException).
 */
public class ParserException extends Exception {

    public ParserException() {
        super();
    }
    public ParserException(String message) {
        super(message);
    }
    public ParserException(Throwable cause) {
        super(cause);
    }
    public ParserException(String message, Throwable cause) {
        super(message, cause);
    }

}
