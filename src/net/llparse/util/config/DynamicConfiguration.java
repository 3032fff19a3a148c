package net.llparse.util.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A Configuration layered over a list of other Configurations.
 * Explicit overrides take precedence over all layers; the layers are
 * consulted in order. Lookups are memoized (including misses) until the
 * layer list changes or invalidate() is called.
 */
public class DynamicConfiguration implements Configuration {

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    /* llparse.trace.logger is looked up as LLPARSE_TRACE_LOGGER. */
    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(envName(key));
        }
    };

    private final List<Configuration> layers;
    private final Map<String, String> overrides;
    private final Map<String, String> resolved;

    public DynamicConfiguration(Configuration... layers) {
        this.layers = new ArrayList<Configuration>(Arrays.asList(layers));
        this.overrides = new HashMap<String, String>();
        this.resolved = new HashMap<String, String>();
    }

    public synchronized String get(String key) {
        if (overrides.containsKey(key)) return overrides.get(key);
        if (resolved.containsKey(key)) return resolved.get(key);
        String value = lookup(key);
        resolved.put(key, value);
        return value;
    }

    protected String lookup(String key) {
        for (Configuration layer : layers) {
            String value = layer.get(key);
            if (value != null) return value;
        }
        return null;
    }

    public synchronized void put(String key, String value) {
        overrides.put(key, value);
    }

    public synchronized void remove(String key) {
        overrides.remove(key);
    }

    public synchronized void invalidate() {
        resolved.clear();
    }

    public synchronized void addSource(Configuration layer) {
        layers.add(layer);
        resolved.clear();
    }
    public synchronized void removeSource(Configuration layer) {
        if (layers.remove(layer)) resolved.clear();
    }

    public static String envName(String key) {
        return key.toUpperCase().replace('.', '_');
    }

    public static DynamicConfiguration makeDefault() {
        return new DynamicConfiguration(PROPERTY_SOURCE, ENV_SOURCE);
    }

}
