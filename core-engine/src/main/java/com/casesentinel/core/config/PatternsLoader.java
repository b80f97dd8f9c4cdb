package com.casesentinel.core.config;

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
 * Loads and validates {@link PatternsConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_PATTERNS_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}; the bundled
 * defaults live in {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code load*} method calls {@link PatternsConfig#validate()} after
 * parsing, so a malformed path expression stops the run before any dataset
 * is scanned.
 * </p>
 *
 * @since 1.0.0
 */
public final class PatternsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PatternsLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_PATTERNS_PATH = "PATTERNS_CONFIG_PATH";

    /** Bundled default tables. */
    public static final String DEFAULT_RESOURCE = "detection-patterns.yml";

    private PatternsLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load patterns using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static PatternsConfig load() {
        String envPath = System.getenv(ENV_PATTERNS_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading detection patterns from environment path: {}", envPath);
            return fromFile(envPath);
        }
        return defaults();
    }

    /**
     * @return the bundled default tables
     */
    public static PatternsConfig defaults() {
        LOG.debug("Loading detection patterns from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load patterns from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static PatternsConfig fromFile(String path) {
        Objects.requireNonNull(path, "Patterns file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Patterns file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read patterns file: " + path, e);
        }
    }

    /**
     * Load patterns from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static PatternsConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = PatternsLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static PatternsConfig parseAndValidate(InputStream is, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(PatternsConfig.class, options));

        PatternsConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed patterns YAML in " + origin + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new IllegalStateException("Patterns configuration is empty: " + origin);
        }
        config.validate();

        LOG.info("Loaded detection patterns from {}: {} extension(s), {} keyword(s), {} path pattern(s), "
                        + "{} artifact type(s)",
                origin,
                config.getExecutableExtensions().size(),
                config.getSuspiciousKeywords().size(),
                config.getSuspiciousPaths().size(),
                config.getArtifactTypes().size());
        return config;
    }
}
