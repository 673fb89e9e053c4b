package com.driftsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Reads the JSON {@link BaselineData} document named by {@code BASELINE_PATH}.
 *
 * @since 1.0.0
 */
public final class BaselineLoader {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineLoader.class);

    private BaselineLoader() {
        // utility class, not instantiable
    }

    /**
     * Load a baseline document from the file system.
     *
     * @param path path to the JSON file; must not be {@code null}
     * @return the parsed document
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static BaselineData fromFile(String path) {
        Objects.requireNonNull(path, "Baseline path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parse(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Baseline file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read baseline file " + path + ": " + e.getMessage(), e);
        }
    }

    static BaselineData parse(InputStream is, String source) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
        BaselineData data = mapper.readValue(is, BaselineData.class);
        if (data == null || data.getSeries() == null) {
            throw new IllegalStateException("Baseline document " + source + " has no 'series'");
        }
        LOG.info("Loaded baseline from {}: {} series sample(s), {} reference row(s)",
                source, data.getSeries().length,
                data.getReference() != null ? data.getReference().length : data.getSeries().length);
        return data;
    }
}
