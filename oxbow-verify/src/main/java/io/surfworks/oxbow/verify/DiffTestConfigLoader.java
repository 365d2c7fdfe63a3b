package io.surfworks.oxbow.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and saves {@link DiffTestConfig}.
 *
 * <p>File format:
 * <pre>{@code
 * {
 *   "referenceCompiler": "/usr/bin/gcc-13",
 *   "targetCompiler": "rustc",
 *   "timeoutSeconds": 10,
 *   "compareStderr": false
 * }
 * }</pre>
 * Missing fields keep their defaults.
 */
public final class DiffTestConfigLoader {

    private static final Logger LOG = Logger.getLogger(DiffTestConfigLoader.class.getName());

    private static final ObjectMapper JSON = new ObjectMapper();

    private DiffTestConfigLoader() {
    }

    /**
     * Loads configuration from the default config file, or defaults if it doesn't exist.
     */
    public static DiffTestConfig load() {
        return load(DiffTestConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * <p>An unreadable or malformed file is logged and yields the defaults.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     */
    public static DiffTestConfig load(Path configFile) {
        DiffTestConfig config = DiffTestConfig.defaults();
        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }
        return config;
    }

    /**
     * Saves configuration to a specific file, creating parent directories.
     *
     * @throws IOException if saving fails
     */
    public static void save(DiffTestConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("referenceCompiler", config.referenceCompiler());
        root.put("targetCompiler", config.targetCompiler());
        root.put("timeoutSeconds", config.timeout().toSeconds());
        root.put("compareStderr", config.compareStderr());

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static DiffTestConfig loadFromFile(Path configFile, DiffTestConfig base) {
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                LOG.warning(() -> "Ignoring " + configFile + ": not a JSON object");
                return base;
            }

            DiffTestConfig config = base
                    .withReferenceCompiler(getStringOrDefault(root, "referenceCompiler", base.referenceCompiler()))
                    .withTargetCompiler(getStringOrDefault(root, "targetCompiler", base.targetCompiler()));

            if (root.has("timeoutSeconds")) {
                config = config.withTimeout(Duration.ofSeconds(root.get("timeoutSeconds").asLong()));
            }
            if (root.has("compareStderr")) {
                config = config.withCompareStderr(root.get("compareStderr").asBoolean());
            }
            return config;

        } catch (IOException | IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Ignoring invalid config file " + configFile, e);
            return base;
        }
    }

    private static String getStringOrDefault(JsonNode node, String field, String defaultValue) {
        if (node.has(field)) {
            return node.get(field).asText();
        }
        return defaultValue;
    }
}
