package net.llparse.util.parser;

import net.llparse.util.config.Configuration;

public class ParserSettings {

    public static final String K_TRACE = "llparse.trace";
    public static final String K_TRACE_LOGGER = "llparse.trace.logger";

    private final boolean trace;
    private final String traceLogger;

    public ParserSettings(boolean trace, String traceLogger) {
        this.trace = trace;
        this.traceLogger = traceLogger;
    }
    public ParserSettings(Configuration config) {
        this(Boolean.parseBoolean(config.get(K_TRACE)),
             withDefault(config.get(K_TRACE_LOGGER),
                         LoggingTraceListener.DEFAULT_LOGGER));
    }
    public ParserSettings() {
        this(Configuration.DEFAULT);
    }

    public String toString() {
        return String.format("%s@%h[trace=%s,traceLogger=%s]",
            getClass().getName(), this, trace, traceLogger);
    }

    public boolean isTracing() {
        return trace;
    }

    public String getTraceLogger() {
        return traceLogger;
    }

    public TraceListener createTraceListener() {
        if (! trace) return TraceListener.NULL;
        return new LoggingTraceListener(traceLogger);
    }

    private static String withDefault(String value, String def) {
        return (value == null || value.isEmpty()) ? def : value;
    }

}
