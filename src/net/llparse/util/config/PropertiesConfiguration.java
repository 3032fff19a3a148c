package net.llparse.util.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class PropertiesConfiguration implements Configuration {

    private final Properties base;

    public PropertiesConfiguration(Properties base) {
        this.base = base;
    }

    public Properties getBase() {
        return base;
    }

    public String get(String key) {
        return base.getProperty(key);
    }

    public static PropertiesConfiguration load(InputStream in)
            throws IOException {
        Properties props = new Properties();
        props.load(in);
        return new PropertiesConfiguration(props);
    }
    public static PropertiesConfiguration load(File path)
            throws IOException {
        InputStream in = new FileInputStream(path);
        try {
            return load(in);
        } finally {
            in.close();
        }
    }

    /* Load a properties file from the classpath; a missing resource yields
     * an empty configuration. */
    public static PropertiesConfiguration loadResource(ClassLoader loader,
            String name) throws IOException {
        InputStream in = loader.getResourceAsStream(name);
        if (in == null) return new PropertiesConfiguration(new Properties());
        try {
            return load(in);
        } finally {
            in.close();
        }
    }

}
