package io.surfworks.equigraph.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Loads {@link EquigraphConfig}.
 *
 * <p>Configuration sources (in order of precedence):
 * <ol>
 *   <li>An explicit path passed to {@link #load(Path)}</li>
 *   <li>The file named by the {@code equigraph.config} system property</li>
 *   <li>The classpath resource {@code /equigraph.json}</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <p>Fields missing from a file keep their default values. Example file:
 * <pre>{@code
 * {
 *   "defaultInclude": ["canonicalize"],
 *   "maxRewriteIterations": 16,
 *   "checkIntegrity": true
 * }
 * }</pre>
 */
public final class EquigraphConfigLoader {

    private static final Logger LOG = Logger.getLogger(EquigraphConfigLoader.class.getName());

    public static final String CONFIG_PROPERTY = "equigraph.config";
    public static final String DEFAULT_RESOURCE = "/equigraph.json";

    private static final Gson GSON = new Gson();

    private EquigraphConfigLoader() {
    }

    /**
     * Loads configuration from the highest-precedence source available.
     *
     * @return the loaded configuration
     * @throws ConfigurationException if a source exists but cannot be parsed
     */
    public static EquigraphConfig load() {
        String property = System.getProperty(CONFIG_PROPERTY);
        if (property != null && !property.isBlank()) {
            return load(Path.of(property));
        }
        return loadResource(DEFAULT_RESOURCE);
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     * @throws ConfigurationException if the file is missing or malformed
     */
    public static EquigraphConfig load(Path configFile) {
        if (!Files.exists(configFile)) {
            throw new ConfigurationException("Config file not found: " + configFile);
        }
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            EquigraphConfig config = parse(reader, configFile.toString());
            LOG.info("Loaded equigraph config from " + configFile);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file " + configFile, e);
        }
    }

    /**
     * Loads configuration from a classpath resource, falling back to defaults when the
     * resource does not exist.
     *
     * @param resource absolute resource name
     * @return the loaded configuration
     * @throws ConfigurationException if the resource exists but is malformed
     */
    public static EquigraphConfig loadResource(String resource) {
        InputStream in = EquigraphConfigLoader.class.getResourceAsStream(resource);
        if (in == null) {
            LOG.fine(() -> "No " + resource + " on the classpath, using defaults");
            return EquigraphConfig.defaults();
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            EquigraphConfig config = parse(reader, resource);
            LOG.info("Loaded equigraph config from classpath " + resource);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config resource " + resource, e);
        }
    }

    private static EquigraphConfig parse(Reader reader, String source) {
        ConfigFile file;
        try {
            file = GSON.fromJson(reader, ConfigFile.class);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed config in " + source, e);
        }
        EquigraphConfig config = EquigraphConfig.defaults();
        if (file == null) {
            return config;
        }
        try {
            if (file.defaultInclude != null) {
                config = config.withDefaultInclude(file.defaultInclude);
            }
            if (file.maxRewriteIterations != null) {
                config = config.withMaxRewriteIterations(file.maxRewriteIterations);
            }
            if (file.checkIntegrity != null) {
                config = config.withCheckIntegrity(file.checkIntegrity);
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid config in " + source + ": " + e.getMessage(), e);
        }
        return config;
    }

    /**
     * JSON shape of the config file. Boxed fields so absent keys stay null.
     */
    private static final class ConfigFile {
        List<String> defaultInclude;
        Integer maxRewriteIterations;
        Boolean checkIntegrity;
    }
}
