package fr.lapetina.webhook.relay;

import fr.lapetina.webhook.relay.infrastructure.config.RelayConfig;
import fr.lapetina.webhook.relay.integration.TestRelayFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookRelayApplicationTest {

    @Nested
    @DisplayName("Configuration check")
    class ConfigurationCheck {

        @Test
        @DisplayName("should report ready for a complete configuration")
        void shouldReportReady() {
            try (TestRelayFactory factory = TestRelayFactory.create()) {
                assertThat(WebhookRelayApplication.checkConfiguration(factory))
                        .isEqualTo(WebhookRelayApplication.EXIT_READY);
            }
        }

        @Test
        @DisplayName("should report degraded when the topic is missing")
        void shouldReportDegradedWithoutTopic() {
            try (TestRelayFactory factory = TestRelayFactory.create(new RelayConfig())) {
                assertThat(WebhookRelayApplication.checkConfiguration(factory))
                        .isEqualTo(WebhookRelayApplication.EXIT_DEGRADED);
                assertThat(factory.getWebhookHandler().getConfigurationProblem())
                        .contains("GCP_PROJECT", "TOPIC_NAME");
            }
        }

        @Test
        @DisplayName("should report degraded when the broker client cannot be created")
        void shouldReportDegradedWhenBrokerUnavailable() {
            RelayConfig config = new RelayConfig();
            config.getPubsub().setProject("test-project");
            config.getPubsub().setTopicName("webhooks");

            try (RelayFactory factory = TestRelayFactory.withBrokerFactory(config, topic -> {
                throw new IOException("no credentials");
            })) {
                assertThat(WebhookRelayApplication.checkConfiguration(factory))
                        .isEqualTo(WebhookRelayApplication.EXIT_DEGRADED);
            }
        }
    }

    @Nested
    @DisplayName("Arguments")
    class Arguments {

        @Test
        @DisplayName("should default to the bundled configuration")
        void shouldUseDefaultPath() {
            assertThat(WebhookRelayApplication.configPath(new String[0])).isEqualTo("webhook-relay.yaml");
            assertThat(WebhookRelayApplication.isCheckOnly(new String[0])).isFalse();
        }

        @Test
        @DisplayName("should accept the check flag before or after the path")
        void shouldFindPathAroundFlag() {
            String[] flagFirst = {"--check-config", "relay.yaml"};
            String[] flagLast = {"relay.yaml", "--check-config"};

            assertThat(WebhookRelayApplication.configPath(flagFirst)).isEqualTo("relay.yaml");
            assertThat(WebhookRelayApplication.configPath(flagLast)).isEqualTo("relay.yaml");
            assertThat(WebhookRelayApplication.isCheckOnly(flagFirst)).isTrue();
            assertThat(WebhookRelayApplication.isCheckOnly(flagLast)).isTrue();
        }
    }
}
