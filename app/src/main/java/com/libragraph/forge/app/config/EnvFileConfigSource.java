package com.libragraph.forge.app.config;

import com.libragraph.forge.util.PropertyFiles;
import org.eclipse.microprofile.config.spi.ConfigSource;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Local overrides from a {@code .properties} file, typically holding developer
 * secrets kept out of version control. The file is named by the
 * {@code forge.env-file} system property and defaults to {@code dev/env.properties}.
 * A missing file contributes nothing.
 * <p>
 * Ordinal 350 places it above environment variables (300) and below system
 * properties (400).
 */
public class EnvFileConfigSource implements ConfigSource {

    private static final Logger log = Logger.getLogger(EnvFileConfigSource.class);

    public static final String FILE_PROPERTY = "forge.env-file";
    public static final String DEFAULT_FILE = "dev/env.properties";
    static final int ORDINAL = 350;

    private final Path file;
    private final Map<String, String> properties;

    public EnvFileConfigSource() {
        this(Path.of(System.getProperty(FILE_PROPERTY, DEFAULT_FILE)));
    }

    public EnvFileConfigSource(Path file) {
        this.file = file;
        this.properties = PropertyFiles.readIfExists(file)
                .map(EnvFileConfigSource::toMap)
                .orElseGet(Map::of);
        if (!properties.isEmpty()) {
            log.debugf("Loaded %d properties from %s", properties.size(), file);
        }
    }

    private static Map<String, String> toMap(Properties props) {
        return Map.copyOf(PropertyFiles.merge(Map.of(), props));
    }

    @Override
    public Set<String> getPropertyNames() {
        return properties.keySet();
    }

    @Override
    public String getValue(String propertyName) {
        return properties.get(propertyName);
    }

    @Override
    public String getName() {
        return "EnvFileConfigSource[" + file + "]";
    }

    @Override
    public int getOrdinal() {
        return ORDINAL;
    }
}
