package net.llparse.api.parser;

/**
 * Exception thrown on object mapping failures.
 * In particular, this is raised when a parse tree has a shape a Mapper does
 * not recognize.
 */
public class MappingException extends ParserException {

    public MappingException() {
        super();
    }
    public MappingException(String message) {
        super(message);
    }
    public MappingException(Throwable cause) {
        super(cause);
    }
    public MappingException(String message, Throwable cause) {
        super(message, cause);
    }

}
