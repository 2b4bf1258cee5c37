package net.morkit.util.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DynamicConfiguration implements Configuration {

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(environmentName(key));
        }
    };

    private final List<Configuration> sources;
    private final Map<String, String> overrides;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        overrides = new LinkedHashMap<String, String>();
    }

    public String get(String key) {
        if (overrides.containsKey(key)) return overrides.get(key);
        for (Configuration src : sources) {
            String ret = src.get(key);
            if (ret != null) return ret;
        }
        return null;
    }

    public void put(String key, String value) {
        overrides.put(key, value);
    }

    public void remove(String key) {
        overrides.remove(key);
    }

    public void addSource(Configuration source) {
        sources.add(source);
    }
    public void removeSource(Configuration source) {
        sources.remove(source);
    }

    /* morkit.mask.threshold -> MORKIT_MASK_THRESHOLD */
    public static String environmentName(String key) {
        return key.toUpperCase().replace('.', '_').replace('-', '_');
    }

    public static DynamicConfiguration makeDefault() {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        return ret;
    }

}
