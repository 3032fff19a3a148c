package net.llparse.util.config;

/* Keys are dotted lower-case names such as "llparse.trace"; get() returns
 * null for keys that are not set. */
public interface Configuration {

    Configuration NULL = new DynamicConfiguration();

    // System properties, then environment variables.
    Configuration DEFAULT = DynamicConfiguration.makeDefault();

    String get(String key);

}
