package io.tempora.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import io.tempora.spi.config.Config;
import io.tempora.spi.config.ConfigFactory;

public class PropertyUtils
{
    private PropertyUtils()
    { }

    public static Properties loadFile(Path file)
        throws IOException
    {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        return props;
    }

    /**
     * Flat config whose keys are the property names and values are strings.
     */
    public static Config toConfig(Properties props, ConfigFactory cf)
    {
        Config config = cf.create();
        for (String key : props.stringPropertyNames()) {
            config.set(key, props.getProperty(key));
        }
        return config;
    }
}
