package net.morkit.util.config;

public interface Configuration {

    Configuration NULL = new DynamicConfiguration();

    /* System properties first, then the environment. */
    Configuration DEFAULT = DynamicConfiguration.makeDefault();

    /* Returns null for unset keys. */
    String get(String key);

}
