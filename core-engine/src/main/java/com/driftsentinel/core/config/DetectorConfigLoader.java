package com.driftsentinel.core.config;

import com.driftsentinel.core.exception.InvalidParametersException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates a {@link DetectorConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * Every {@code from*} method validates after parsing, so a misconfigured
 * detector fails at startup rather than on the first window.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "DETECTOR_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "detector.yml";

    private DetectorConfigLoader() {
        // utility class, not instantiable
    }

    /**
     * Load the configuration using automatic resolution: the file named by
     * {@code DETECTOR_CONFIG_PATH} if it exists, otherwise
     * {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @return parsed and validated configuration
     */
    public static DetectorConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading detector config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading detector config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load the configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException   if the file does not exist
     * @throws IllegalStateException      if reading or parsing fails
     * @throws InvalidParametersException if validation fails
     */
    public static DetectorConfig fromFile(String path) {
        Objects.requireNonNull(path, "Detector config path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Detector config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read detector config file: " + path, e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException   if the resource does not exist
     * @throws IllegalStateException      if reading or parsing fails
     * @throws InvalidParametersException if validation fails
     */
    public static DetectorConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DetectorConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static DetectorConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectorSettings.class, options));

        DetectorSettings settings;
        try {
            settings = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed detector config in " + source + ": " + e.getMessage(), e);
        }

        if (settings == null) {
            LOG.warn("Detector config {} is empty, using defaults", source);
            settings = new DetectorSettings();
        }

        DetectorConfig config = settings.toConfig();
        LOG.info("Loaded {}", config);
        return config;
    }
}
