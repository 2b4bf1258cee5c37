package net.morkit.util.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class PropertiesConfiguration implements Configuration {

    private final Properties base;

    public PropertiesConfiguration(Properties base) {
        if (base == null)
            throw new NullPointerException("Properties may not be null");
        this.base = base;
    }
    public PropertiesConfiguration(File path) throws IOException {
        this(loadProperties(path));
    }

    public Properties getBase() {
        return base;
    }

    public String get(String key) {
        return base.getProperty(key);
    }

    public static Properties loadProperties(File path) throws IOException {
        Properties ret = new Properties();
        InputStream in = new FileInputStream(path);
        try {
            ret.load(in);
        } finally {
            in.close();
        }
        return ret;
    }

}
