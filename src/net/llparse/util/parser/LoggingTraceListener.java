package net.llparse.util.parser;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.llparse.api.parser.ParsingException;
import net.llparse.api.parser.Token;

public class LoggingTraceListener implements TraceListener {

    public static final String DEFAULT_LOGGER = "LLTrace";

    private final Logger logger;

    public LoggingTraceListener(Logger logger) {
        this.logger = logger;
    }
    public LoggingTraceListener(String loggerName) {
        this(Logger.getLogger(loggerName));
    }
    public LoggingTraceListener() {
        this(DEFAULT_LOGGER);
    }

    public Logger getLogger() {
        return logger;
    }

    public void step(List<Symbol> stack, Token lookahead, Terminal terminal,
                     int position) {
        if (! logger.isLoggable(Level.FINE)) return;
        logger.fine("Step at " + position + ": stack=" + stack +
            ", lookahead=" + terminal + " '" + lookahead.getContent() + "'");
    }

    public void expand(Production prod, int position) {
        logger.log(Level.FINE, "Expand at {0}: {1}",
                   new Object[] { position, prod });
    }

    public void match(Terminal terminal, Token token, int position) {
        logger.log(Level.FINE, "Match at {0}: {1} ''{2}''",
                   new Object[] { position, terminal, token.getContent() });
    }

    public void accept(int position) {
        logger.log(Level.FINE, "Accepted input at {0}", position);
    }

    public void reject(ParsingException exc) {
        logger.log(Level.FINE, "Rejected input", exc);
    }

}
