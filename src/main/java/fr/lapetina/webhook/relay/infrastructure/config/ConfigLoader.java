package fr.lapetina.webhook.relay.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from file system or classpath, falling back to defaults when neither exists
 * - Overriding values from environment variables, which always win over the file
 *
 * Loading happens once at startup; the result is validated into {@link RelaySettings}.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String ENV_GCP_PROJECT = "GCP_PROJECT";
    public static final String ENV_TOPIC_NAME = "TOPIC_NAME";
    public static final String ENV_TOPIC_PROJECT = "TOPIC_PROJECT";
    public static final String ENV_IP_WHITELIST = "IP_WHITELIST";
    public static final String ENV_PORT = "PORT";
    public static final String ENV_PUBLISH_TIMEOUT_MS = "PUBLISH_TIMEOUT_MS";

    private final Path configPath;
    private final Map<String, String> environment;
    private final Yaml yaml;

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = Map.copyOf(environment);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(RelayConfig.class, loaderOptions));
    }

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    /**
     * Loads configuration from file or classpath and applies environment overrides.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if the file exists but cannot be read or parsed
     */
    public RelayConfig load() {
        RelayConfig config = loadFromPath();
        applyEnvironment(config);
        return config;
    }

    /**
     * Loads configuration from an input stream and applies environment overrides.
     */
    public RelayConfig loadFromStream(InputStream inputStream) {
        RelayConfig config = parse(inputStream, "stream");
        applyEnvironment(config);
        return config;
    }

    private RelayConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        log.info("No configuration file found at {}, using defaults and environment", configPath);
        return new RelayConfig();
    }

    private RelayConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private RelayConfig parse(InputStream inputStream, String origin) {
        try {
            RelayConfig config = yaml.load(inputStream);
            return config != null ? config : new RelayConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironment(RelayConfig config) {
        RelayConfig.PubSubConfig pubsub = config.getPubsub();
        env(ENV_GCP_PROJECT).ifPresent(pubsub::setProject);
        env(ENV_TOPIC_NAME).ifPresent(pubsub::setTopicName);
        env(ENV_TOPIC_PROJECT).ifPresent(pubsub::setTopicProject);

        env(ENV_IP_WHITELIST).ifPresent(value -> config.getAllowList().setRanges(splitRanges(value)));

        env(ENV_PORT).ifPresent(value -> config.getServer().setPort(parseNumber(ENV_PORT, value).intValue()));
        env(ENV_PUBLISH_TIMEOUT_MS).ifPresent(value ->
                config.getPublish().setTimeoutMs(parseNumber(ENV_PUBLISH_TIMEOUT_MS, value)));
    }

    private Optional<String> env(String name) {
        String value = environment.get(name);
        if (value == null) {
            return Optional.empty();
        }
        log.debug("Configuration override from environment: {}", name);
        return Optional.of(value);
    }

    static List<String> splitRanges(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static Long parseNumber(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Environment variable " + name + " is not a number: " + value, e);
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
