package net.llparse.api.parser;

/**
 * Exception thrown when a token sequence is rejected by a parser.
 * This covers terminal mismatches, missing parse table entries, unexpected
 * trailing input, and premature ends of input. Not to be confused with the
 * generic ParserException.
 * A ParsingException only aborts the parse that raised it; the parser (and
 * its tables) remain usable for further inputs.
 */
public class ParsingException extends LocatedParserException {

    public ParsingException(int pos) {
        super(pos);
    }
    public ParsingException(int pos, String message) {
        super(pos, message);
    }
    public ParsingException(int pos, Throwable cause) {
        super(pos, cause);
    }
    public ParsingException(int pos, String message, Throwable cause) {
        super(pos, message, cause);
    }

}
