package com.libragraph.forge.util;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Reads {@code .properties} files into string maps.
 * <p>
 * Typical use merges defaults with a local env file, the file winning:
 * <pre>
 *   Map&lt;String, String&gt; env = PropertyFiles.merge(defaults, PropertyFiles.read(path));
 * </pre>
 */
public final class PropertyFiles {

    private PropertyFiles() {
    }

    /** Parses the file with {@link Properties#load(Reader)} syntax, read as UTF-8. */
    public static Properties read(Path path) {
        Objects.requireNonNull(path, "path cannot be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Properties props = new Properties();
            props.load(reader);
            return props;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read properties from " + path, e);
        }
    }

    /** Like {@link #read(Path)}, but empty when the file does not exist. */
    public static Optional<Properties> readIfExists(Path path) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return Optional.of(read(path));
    }

    /** Flattens to a string map. Later sources override earlier ones. */
    public static Map<String, String> merge(Map<String, String> base, Properties overrides) {
        Map<String, String> merged = new LinkedHashMap<>(base);
        for (String name : overrides.stringPropertyNames()) {
            merged.put(name, overrides.getProperty(name));
        }
        return merged;
    }
}
