package fr.lapetina.webhook.relay;

import fr.lapetina.webhook.relay.api.HttpServer;
import fr.lapetina.webhook.relay.infrastructure.config.RelayConfig;
import fr.lapetina.webhook.relay.infrastructure.config.RelaySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Webhook Relay.
 *
 * <p>Usage: {@code WebhookRelayApplication [--check-config] [config.yaml]}
 *
 * <p>With {@code --check-config} the relay builds its components, reports whether it could serve
 * and exits without opening a port: 0 when ready, 2 when it would run degraded, 1 when the
 * configuration file cannot be read.
 */
public class WebhookRelayApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WebhookRelayApplication.class);

    static final String CHECK_CONFIG_FLAG = "--check-config";
    static final String DEFAULT_CONFIG_PATH = "webhook-relay.yaml";
    static final int EXIT_READY = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_DEGRADED = 2;

    private final RelayFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public WebhookRelayApplication(String configPath) throws Exception {
        this(RelayFactory.create(configPath));
    }

    public WebhookRelayApplication(RelayFactory factory) throws Exception {
        log.info("Starting Webhook Relay...");

        this.factory = factory;

        RelayConfig.ServerConfig server = factory.getConfig().getServer();
        this.httpServer = new HttpServer(
                server.getHost(),
                server.getPort(),
                server.getBacklog(),
                server.getWorkerThreads(),
                server.getPath(),
                factory.getWebhookHandler(),
                factory.getMetricsRegistry()
        );

        log.info("Webhook Relay initialized");
    }

    public void start() {
        httpServer.start();
        if (factory.isDegraded()) {
            log.warn("Webhook Relay started in degraded mode on port {}", httpServer.getPort());
        } else {
            log.info("Webhook Relay started on port {}", httpServer.getPort());
        }
    }

    public int getPort() {
        return httpServer.getPort();
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public RelayFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down Webhook Relay...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Webhook Relay shut down");
    }

    /**
     * Reports whether the factory produced a relay that can publish.
     *
     * @return {@link #EXIT_READY} or {@link #EXIT_DEGRADED}
     */
    static int checkConfiguration(RelayFactory factory) {
        if (factory.isDegraded()) {
            log.error("Configuration check failed: {}", factory.getWebhookHandler().getConfigurationProblem());
            return EXIT_DEGRADED;
        }
        RelaySettings settings = factory.getSettings();
        log.info("Configuration check passed: topic={}, publishTimeout={}ms, allowList={}, challengeRules={}",
                settings.topic(), settings.publishTimeout().toMillis(), settings.allowList(),
                settings.challengeRules().size());
        return EXIT_READY;
    }

    static String configPath(String[] args) {
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                return arg;
            }
        }
        return DEFAULT_CONFIG_PATH;
    }

    static boolean isCheckOnly(String[] args) {
        for (String arg : args) {
            if (CHECK_CONFIG_FLAG.equals(arg)) {
                return true;
            }
        }
        return false;
    }

    public static void main(String[] args) {
        String configPath = configPath(args);

        if (isCheckOnly(args)) {
            int status;
            try (RelayFactory factory = RelayFactory.create(configPath)) {
                status = checkConfiguration(factory);
            } catch (Exception e) {
                log.error("Configuration check failed: cannot load {}", configPath, e);
                status = EXIT_FAILED;
            }
            System.exit(status);
            return;
        }

        try {
            WebhookRelayApplication app = new WebhookRelayApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Webhook Relay", e);
            System.exit(EXIT_FAILED);
        }
    }
}
