package net.llparse.api.parser;

/**
 * A generic ParserException that has an associated token position.
 * The position is the 0-based index of the offending token inside the token
 * sequence being parsed, or NO_POSITION if it is not known.
 */
public class LocatedParserException extends ParserException {

    /**
     * Position value for exceptions not tied to any particular token.
     */
    public static final int NO_POSITION = -1;

    private final int position;

    public LocatedParserException(int pos) {
        super();
        position = pos;
    }
    public LocatedParserException(int pos, String message) {
        super(message);
        position = pos;
    }
    public LocatedParserException(int pos, Throwable cause) {
        super(cause);
        position = pos;
    }
    public LocatedParserException(int pos, String message,
                                  Throwable cause) {
        super(message, cause);
        position = pos;
    }

    /**
     * The index of the token this exception refers to, or NO_POSITION.
     */
    public int getPosition() {
        return position;
    }

}
