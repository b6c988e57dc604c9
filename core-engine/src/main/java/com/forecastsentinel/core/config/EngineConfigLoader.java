package com.forecastsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@link EngineConfig} from YAML.
 *
 * <p>
 * {@link #load()} looks in three places, first match wins:
 * </p>
 * <ol>
 * <li>the file named by {@value #ENV_CONFIG_PATH}; a set but missing path is
 * an error, not a fall-through;</li>
 * <li>{@value #DEFAULT_RESOURCE} on the classpath;</li>
 * <li>{@link EngineConfig#defaults()}.</li>
 * </ol>
 *
 * <p>
 * Keys left out of a file keep their default value. Duplicate keys, unknown
 * keys and malformed YAML are rejected with an {@link IllegalStateException}
 * naming the source, as is any value {@link EngineConfig#validate()} refuses.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);

    /** Environment variable holding an explicit config file path. */
    public static final String ENV_CONFIG_PATH = "ENGINE_CONFIG_PATH";

    /** Classpath resource bundled with the engine. */
    public static final String DEFAULT_RESOURCE = "engine.yml";

    private EngineConfigLoader() {
        // utility class, not instantiable
    }

    /**
     * @return the configuration for this process
     * @throws IllegalArgumentException if {@value #ENV_CONFIG_PATH} names a
     *                                  missing file
     * @throws IllegalStateException    if the chosen source is unreadable or
     *                                  invalid
     */
    public static EngineConfig load() {
        return load(System.getenv(ENV_CONFIG_PATH), EngineConfigLoader.class.getClassLoader());
    }

    static EngineConfig load(String overridePath, ClassLoader classLoader) {
        if (overridePath != null && !overridePath.isBlank()) {
            LOG.info("{} is set, reading {}", ENV_CONFIG_PATH, overridePath);
            return fromFile(Path.of(overridePath.trim()));
        }
        if (classLoader.getResource(DEFAULT_RESOURCE) != null) {
            return fromClasspath(classLoader, DEFAULT_RESOURCE);
        }
        return accept(EngineConfig.defaults(), "built-in defaults");
    }

    /**
     * @param path YAML file; must not be {@code null}
     * @return the validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if it cannot be read or is invalid
     */
    public static EngineConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Engine config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read engine config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return the validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if it cannot be read or is invalid
     */
    public static EngineConfig fromClasspath(String resource) {
        return fromClasspath(EngineConfigLoader.class.getClassLoader(), resource);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static EngineConfig fromClasspath(ClassLoader classLoader, String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        String source = "classpath:" + resource;
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Classpath resource not found: " + resource);
            }
            return parse(new InputStreamReader(in, StandardCharsets.UTF_8), source);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + source, e);
        }
    }

    private static EngineConfig parse(Reader reader, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        EngineConfig config;
        try {
            config = new Yaml(new Constructor(EngineConfig.class, options)).load(reader);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed engine configuration in " + source + ": "
                    + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("{} is empty, using built-in defaults", source);
            config = EngineConfig.defaults();
        }
        return accept(config, source);
    }

    private static EngineConfig accept(EngineConfig config, String source) {
        config.validate();
        LOG.info("Engine configuration from {}: {}", source, config);
        return config;
    }
}
