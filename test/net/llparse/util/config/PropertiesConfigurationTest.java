package net.llparse.util.config;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import junit.framework.TestCase;

public class PropertiesConfigurationTest extends TestCase {

    private static final String TEXT =
        "llparse.trace = true\nllparse.trace.logger = FileTrace\n";

    public void testLoadStream() throws Exception {
        PropertiesConfiguration c = PropertiesConfiguration.load(
            new ByteArrayInputStream(TEXT.getBytes(StandardCharsets.UTF_8)));
        assertEquals("true", c.get("llparse.trace"));
        assertEquals("FileTrace", c.get("llparse.trace.logger"));
        assertNull(c.get("llparse.other"));
    }

    public void testLoadFile() throws Exception {
        File f = File.createTempFile("llparse", ".properties");
        try {
            OutputStream out = new FileOutputStream(f);
            try {
                out.write(TEXT.getBytes(StandardCharsets.UTF_8));
            } finally {
                out.close();
            }
            assertEquals("FileTrace", PropertiesConfiguration.load(f)
                                          .get("llparse.trace.logger"));
        } finally {
            f.delete();
        }
    }

    public void testMissingResource() throws Exception {
        PropertiesConfiguration c = PropertiesConfiguration.loadResource(
            getClass().getClassLoader(), "no/such/resource.properties");
        assertTrue(c.getBase().isEmpty());
    }

}
