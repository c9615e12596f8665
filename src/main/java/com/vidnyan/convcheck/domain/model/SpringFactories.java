package com.vidnyan.convcheck.domain.model;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Stream;

/**
 * Typed view of a {@code META-INF/spring.factories} registration file.
 * Only the bootstrap and auto-configuration registration points are read.
 */
public record SpringFactories(
    List<String> bootstrapConfigurations,
    List<String> autoConfigurations
) {

    public static final String BOOTSTRAP_CONFIGURATION_KEY =
            "org.springframework.cloud.bootstrap.BootstrapConfiguration";
    public static final String AUTO_CONFIGURATION_KEY =
            "org.springframework.boot.autoconfigure.EnableAutoConfiguration";

    public static SpringFactories load(Path file) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
            properties.load(reader);
        }
        return new SpringFactories(
                classNames(properties.getProperty(BOOTSTRAP_CONFIGURATION_KEY)),
                classNames(properties.getProperty(AUTO_CONFIGURATION_KEY)));
    }

    /**
     * All registered class names, bootstrap entries first.
     */
    public List<String> allClassNames() {
        return Stream.concat(bootstrapConfigurations.stream(), autoConfigurations.stream()).toList();
    }

    private static List<String> classNames(String value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
