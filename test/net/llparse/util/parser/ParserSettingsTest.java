package net.llparse.util.parser;

import java.util.Properties;
import junit.framework.TestCase;
import net.llparse.util.config.Configuration;
import net.llparse.util.config.PropertiesConfiguration;

public class ParserSettingsTest extends TestCase {

    public void testDefaults() {
        ParserSettings s = new ParserSettings(Configuration.NULL);
        assertFalse(s.isTracing());
        assertEquals(LoggingTraceListener.DEFAULT_LOGGER,
                     s.getTraceLogger());
        assertSame(TraceListener.NULL, s.createTraceListener());
    }

    public void testTracingEnabled() {
        Properties props = new Properties();
        props.setProperty(ParserSettings.K_TRACE, "true");
        props.setProperty(ParserSettings.K_TRACE_LOGGER, "ScriptTrace");
        ParserSettings s = new ParserSettings(
            new PropertiesConfiguration(props));
        assertTrue(s.isTracing());
        TraceListener l = s.createTraceListener();
        assertTrue(l instanceof LoggingTraceListener);
        assertEquals("ScriptTrace",
                     ((LoggingTraceListener) l).getLogger().getName());
    }

}
