package fr.lapetina.webhook.relay.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.webhook.relay.WebhookRelayApplication;
import fr.lapetina.webhook.relay.infrastructure.config.RelayConfig;
import fr.lapetina.webhook.relay.infrastructure.pubsub.StubBrokerClient;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests driving the relay through its HTTP interface.
 * Configuration is externalized to test-webhook-relay.yaml.
 */
class WebhookRelayIntegrationTest {

    private final HttpClient httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private TestRelayFactory factory;
    private WebhookRelayApplication app;

    @BeforeEach
    void setUp() throws Exception {
        factory = TestRelayFactory.create();
        app = new WebhookRelayApplication(factory);
        app.start();
    }

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.close();
        }
    }

    private HttpResponse<String> post(String path, String body, String... headers) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri(path))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (headers.length > 0) {
            builder.headers(headers);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .timeout(Duration.ofSeconds(10))
                .GET()
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + app.getPort() + path);
    }

    @Test
    @DisplayName("should publish webhook and return message id")
    void shouldPublishWebhook() throws Exception {
        factory.getBroker().respondWith("msg-1");

        HttpResponse<String> response = post("/", "{\"event\":\"x\"}");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode ack = objectMapper.readTree(response.body());
        assertThat(ack.get("messageId").asText()).isEqualTo("msg-1");
        assertThat(response.headers().firstValue("X-Request-ID")).isPresent();

        StubBrokerClient broker = factory.getBroker();
        assertThat(broker.getPublished()).singleElement().satisfies(message -> {
            assertThat(new String(message.payload(), StandardCharsets.UTF_8)).isEqualTo("{\"event\":\"x\"}");
            assertThat(message.topic().toString()).isEqualTo("projects/test-project/topics/webhooks");
        });
    }

    @Test
    @DisplayName("should echo challenge without publishing")
    void shouldEchoChallenge() throws Exception {
        HttpResponse<String> response = post("/", "{\"type\":\"url_verification\",\"challenge\":\"abc123\"}");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(objectMapper.readTree(response.body()).get("challenge").asText()).isEqualTo("abc123");
        assertThat(factory.getBroker().getPublishCount()).isZero();
    }

    @Test
    @DisplayName("should echo header challenge without publishing")
    void shouldEchoHeaderChallenge() throws Exception {
        HttpResponse<String> response = post("/", "{}", "X-Hook-Secret", "s3cr3t");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("s3cr3t");
        assertThat(factory.getBroker().getPublishCount()).isZero();
    }

    @Test
    @DisplayName("should reject forwarded caller outside the allow-list")
    void shouldRejectForwardedCaller() throws Exception {
        HttpResponse<String> response = post("/", "{\"event\":\"x\"}", "X-Forwarded-For", "11.0.0.1, 127.0.0.1");

        assertThat(response.statusCode()).isEqualTo(403);
        assertThat(factory.getBroker().getPublishCount()).isZero();
    }

    @Test
    @DisplayName("should accept forwarded caller inside the allow-list")
    void shouldAcceptForwardedCaller() throws Exception {
        HttpResponse<String> response = post("/", "{\"event\":\"x\"}", "X-Forwarded-For", "10.1.2.3");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(factory.getBroker().getPublishCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should reject GET on the webhook endpoint")
    void shouldRejectGet() throws Exception {
        HttpResponse<String> response = get("/");

        assertThat(response.statusCode()).isEqualTo(405);
        assertThat(response.headers().firstValue("Allow")).hasValue("POST");
    }

    @Test
    @DisplayName("should answer 502 when the broker times out")
    void shouldAnswer502OnTimeout() throws Exception {
        factory.getBroker().neverRespond();

        HttpResponse<String> response = post("/", "{\"event\":\"x\"}");

        assertThat(response.statusCode()).isEqualTo(502);
        assertThat(response.body()).isEqualTo("Failed to process webhook");
    }

    @Test
    @DisplayName("should report health")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(objectMapper.readTree(response.body()).get("status").asText()).isEqualTo("UP");
    }

    @Test
    @DisplayName("should expose Prometheus metrics")
    void shouldExposeMetrics() throws Exception {
        post("/", "{\"event\":\"x\"}");

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("test_relay_requests_total");
    }

    @Nested
    @DisplayName("Degraded mode")
    class DegradedMode {

        private WebhookRelayApplication degradedApp;

        @BeforeEach
        void startDegraded() throws Exception {
            RelayConfig config = new RelayConfig();
            config.getServer().setHost("127.0.0.1");
            config.getServer().setPort(0);
            config.getServer().setWorkerThreads(2);
            degradedApp = new WebhookRelayApplication(TestRelayFactory.create(config));
            degradedApp.start();
        }

        @AfterEach
        void stopDegraded() {
            degradedApp.close();
        }

        @Test
        @DisplayName("should answer 500 and report degraded health without a topic")
        void shouldAnswer500WithoutTopic() throws Exception {
            String base = "http://127.0.0.1:" + degradedApp.getPort();
            HttpResponse<String> webhook = httpClient.send(HttpRequest.newBuilder(URI.create(base + "/"))
                    .POST(HttpRequest.BodyPublishers.ofString("{\"event\":\"x\"}"))
                    .build(), HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> health = httpClient.send(HttpRequest.newBuilder(URI.create(base + "/health"))
                    .GET()
                    .build(), HttpResponse.BodyHandlers.ofString());

            assertThat(webhook.statusCode()).isEqualTo(500);
            assertThat(webhook.body()).isEqualTo("Configuration error");
            assertThat(health.statusCode()).isEqualTo(503);
            assertThat(degradedApp.getFactory().isDegraded()).isTrue();
            assertThat(((TestRelayFactory) degradedApp.getFactory()).getBroker().getPublishCount()).isZero();
        }
    }
}
