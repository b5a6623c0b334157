package fr.lapetina.webhook.relay;

import fr.lapetina.webhook.relay.domain.challenge.ChallengeDetector;
import fr.lapetina.webhook.relay.domain.challenge.ChallengeDetectorFactory;
import fr.lapetina.webhook.relay.domain.filter.ClientIpResolver;
import fr.lapetina.webhook.relay.handler.WebhookHandler;
import fr.lapetina.webhook.relay.infrastructure.config.ConfigLoader;
import fr.lapetina.webhook.relay.infrastructure.config.RelayConfig;
import fr.lapetina.webhook.relay.infrastructure.config.RelaySettings;
import fr.lapetina.webhook.relay.infrastructure.metrics.RelayMetrics;
import fr.lapetina.webhook.relay.infrastructure.pubsub.BrokerClientFactory;
import fr.lapetina.webhook.relay.infrastructure.pubsub.PubSubBrokerClient;
import fr.lapetina.webhook.relay.infrastructure.pubsub.PublisherGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Factory for creating a fully-wired webhook handler from configuration.
 *
 * <p>Configuration that is present but incomplete does not stop the process: the factory
 * logs the problem once and produces a degraded handler that answers 500 to every request.
 * Only an unreadable configuration file is fatal.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RelayFactory factory = RelayFactory.create("webhook-relay.yaml")) {
 *     WebhookHandler handler = factory.getWebhookHandler();
 *     // use handler...
 * }
 * }</pre>
 */
public class RelayFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RelayFactory.class);

    private final RelayConfig config;
    private final RelaySettings settings;
    private final RelayMetrics metricsRegistry;
    private final PublisherGateway gateway;
    private final WebhookHandler webhookHandler;

    protected RelayFactory(RelayConfig config, BrokerClientFactory clientFactoryOverride) {
        this.config = config;

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new RelayMetrics(config.getMetrics().getPrefix())
                : null;

        RelaySettings validated = null;
        PublisherGateway createdGateway = null;
        WebhookHandler handler;
        try {
            // Validate configuration
            validated = RelaySettings.from(config);

            // Create challenge detectors
            List<ChallengeDetector> detectors = ChallengeDetectorFactory.createAll(validated.challengeRules());
            log.info("Using {} challenge detector(s): {}", detectors.size(), detectors);

            // Create the broker handle (allow override for testing)
            BrokerClientFactory clientFactory = clientFactoryOverride != null
                    ? clientFactoryOverride
                    : PubSubBrokerClient::create;
            createdGateway = new PublisherGateway(
                    validated.topic(),
                    validated.publishTimeout(),
                    clientFactory,
                    metricsRegistry
            );
            createdGateway.initialize();

            handler = new WebhookHandler(
                    validated.allowList(),
                    new ClientIpResolver(validated.forwardedHeader()),
                    detectors,
                    createdGateway,
                    validated.publishAttributes(),
                    metricsRegistry
            );
            log.info("Relay initialized: topic={}, allowList={}, publishTimeout={}ms",
                    validated.topic(), validated.allowList(), validated.publishTimeout().toMillis());
        } catch (ConfigLoader.ConfigurationException | IllegalArgumentException e) {
            log.error("Invalid configuration, relay will answer every request with 500: {}", e.getMessage());
            handler = WebhookHandler.degraded(e.getMessage(), metricsRegistry);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to create broker client, relay will answer every request with 500", e);
            handler = WebhookHandler.degraded("Broker client unavailable: " + e.getMessage(), metricsRegistry);
        }

        this.settings = validated;
        this.gateway = createdGateway;
        this.webhookHandler = handler;
    }

    /**
     * Creates a factory from the specified configuration file and the process environment.
     *
     * @throws ConfigLoader.ConfigurationException if the configuration file cannot be read
     */
    public static RelayFactory create(String configPath) {
        return create(configPath, System.getenv());
    }

    /**
     * Creates a factory from the specified configuration file and environment.
     */
    public static RelayFactory create(String configPath, Map<String, String> environment) {
        log.info("Initializing RelayFactory from config: {}", configPath);
        RelayConfig config = new ConfigLoader(configPath, environment).load();
        return new RelayFactory(config, null);
    }

    /**
     * Creates a factory from the default configuration (webhook-relay.yaml).
     */
    public static RelayFactory create() {
        return create("webhook-relay.yaml");
    }

    public WebhookHandler getWebhookHandler() {
        return webhookHandler;
    }

    /**
     * Returns the metrics registry, or null when metrics are disabled.
     */
    public RelayMetrics getMetricsRegistry() {
        return metricsRegistry;
    }

    /**
     * Returns the publisher gateway, or null when the relay is degraded before it was created.
     */
    public PublisherGateway getGateway() {
        return gateway;
    }

    /**
     * Returns the validated settings, or null when validation failed.
     */
    public RelaySettings getSettings() {
        return settings;
    }

    public RelayConfig getConfig() {
        return config;
    }

    public boolean isDegraded() {
        return webhookHandler.isDegraded();
    }

    @Override
    public void close() {
        log.info("Shutting down RelayFactory...");

        if (gateway != null) {
            try {
                gateway.close();
            } catch (Exception e) {
                log.warn("Error closing publisher gateway", e);
            }
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("RelayFactory shut down");
    }
}
