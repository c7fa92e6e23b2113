package com.settingsproxy.core.config;

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
 * Loads the {@link DefaultSettings} table from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_DEFAULTS_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates the parsed configuration, so an
 * invalid table fails at start-up instead of at the first lookup.
 * </p>
 *
 * @since 1.0.0
 */
public final class DefaultSettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultSettingsLoader.class);

    /** Environment variable that can override the default table location. */
    public static final String ENV_DEFAULTS_PATH = "SETTINGS_DEFAULTS_PATH";

    /** Classpath resource holding the built-in defaults. */
    public static final String DEFAULT_RESOURCE = "default-settings.yml";

    private DefaultSettingsLoader() {
        // utility class
    }

    /**
     * Load defaults using automatic resolution.
     *
     * @return validated default table
     * @throws IllegalStateException if the content is invalid
     */
    public static DefaultSettings load() {
        String envPath = System.getenv(ENV_DEFAULTS_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading default settings from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading default settings from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load defaults from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return validated default table
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails or the content is invalid
     */
    public static DefaultSettings fromFile(String path) {
        Objects.requireNonNull(path, "Defaults file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Defaults file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read defaults file: " + path, e);
        }
    }

    /**
     * Load defaults from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return validated default table
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails or the content is invalid
     */
    public static DefaultSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DefaultSettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static DefaultSettings parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DefaultSettingsConfig.class, options));

        DefaultSettingsConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed default settings in " + source
                    + ": " + e.getMessage(), e);
        }

        if (config == null || config.getDefaults().isEmpty()) {
            LOG.warn("No default settings defined in {}", source);
            return DefaultSettings.empty();
        }

        DefaultSettings defaults = config.toDefaultSettings();
        LOG.info("Loaded {} default setting(s)", defaults.size());
        return defaults;
    }
}
