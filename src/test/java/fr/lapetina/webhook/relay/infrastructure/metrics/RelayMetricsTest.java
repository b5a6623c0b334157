package fr.lapetina.webhook.relay.infrastructure.metrics;

import fr.lapetina.webhook.relay.domain.model.FailureCause;
import fr.lapetina.webhook.relay.domain.model.RequestOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RelayMetricsTest {

    private RelayMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = new RelayMetrics("relay_test");
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count requests by outcome")
    void shouldCountRequestsByOutcome() {
        metrics.incrementRequestCount(RequestOutcome.PUBLISHED);
        metrics.incrementRequestCount(RequestOutcome.PUBLISHED);
        metrics.incrementRequestCount(RequestOutcome.ORIGIN_REJECTED);

        assertThat(metrics.getRegistry().get("relay_test_requests_total")
                .tag("outcome", "PUBLISHED").counter().count()).isEqualTo(2.0);
        assertThat(metrics.getRegistry().get("relay_test_requests_total")
                .tag("outcome", "ORIGIN_REJECTED").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should count publish failures by cause")
    void shouldCountFailuresByCause() {
        metrics.incrementPublishFailure(FailureCause.TIMEOUT);

        assertThat(metrics.getRegistry().get("relay_test_publish_failures_total")
                .tag("cause", "TIMEOUT").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should record latency and payload size")
    void shouldRecordLatencyAndPayloadSize() {
        metrics.recordPublishLatency(Duration.ofMillis(40), true);
        metrics.recordPayloadSize(128);
        metrics.recordPayloadSize(256);

        assertThat(metrics.getRegistry().get("relay_test_publish_latency")
                .tag("result", "success").timer().count()).isEqualTo(1);
        assertThat(metrics.getRegistry().get("relay_test_payload_bytes")
                .summary().totalAmount()).isEqualTo(384.0);
    }

    @Test
    @DisplayName("should expose meters in Prometheus format")
    void shouldScrapePrometheusText() {
        metrics.incrementRequestCount(RequestOutcome.CHALLENGE_HANDLED);

        String scrape = metrics.scrape();

        assertThat(scrape).contains("relay_test_requests_total");
        assertThat(scrape).contains("outcome=\"CHALLENGE_HANDLED\"");
        assertThat(scrape).contains("jvm_memory_used_bytes");
    }
}
