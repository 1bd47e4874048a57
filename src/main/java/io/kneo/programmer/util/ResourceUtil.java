package io.kneo.programmer.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ResourceUtil {
    public static final String CLASSPATH_PREFIX = "classpath:";

    private ResourceUtil() {}

    /**
     * Reads a {@code classpath:} resource or a filesystem path as UTF-8 text.
     */
    public static String loadAsString(String location) {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return loadResourceAsString(location.substring(CLASSPATH_PREFIX.length()));
        }
        try {
            return Files.readString(Path.of(location), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read file: " + location, e);
        }
    }

    public static String loadResourceAsString(String resourcePath) {
        String path = resourcePath.startsWith("/") ? resourcePath : "/" + resourcePath;
        InputStream is = ResourceUtil.class.getResourceAsStream(path);
        if (is == null) {
            throw new IllegalStateException("Resource not found: " + resourcePath);
        }
        try (is) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read resource: " + resourcePath, e);
        }
    }
}
