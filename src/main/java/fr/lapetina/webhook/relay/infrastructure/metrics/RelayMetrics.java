package fr.lapetina.webhook.relay.infrastructure.metrics;

import fr.lapetina.webhook.relay.domain.model.FailureCause;
import fr.lapetina.webhook.relay.domain.model.RequestOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request counters by outcome
 * - Publish latency timers by result
 * - Publish failure counters by cause
 * - Payload size distribution
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class RelayMetrics implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RelayMetrics.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<RequestOutcome, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<FailureCause, Counter> failureCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> publishTimers = new ConcurrentHashMap<>();
    private final DistributionSummary payloadSizes;

    public RelayMetrics(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.payloadSizes = DistributionSummary.builder(prefix + "_payload_bytes")
                .description("Size of published payloads")
                .baseUnit("bytes")
                .register(registry);

        log.info("RelayMetrics initialized with prefix: {}", prefix);
    }

    public RelayMetrics() {
        this("webhook_relay");
    }

    /**
     * Increments the request counter for an outcome.
     */
    public void incrementRequestCount(RequestOutcome outcome) {
        requestCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of webhook requests")
                        .tag("outcome", outcome.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records the latency of one publish attempt.
     */
    public void recordPublishLatency(Duration latency, boolean success) {
        String result = success ? "success" : "failure";
        publishTimers.computeIfAbsent(result, k ->
                Timer.builder(prefix + "_publish_latency")
                        .description("Broker publish latency")
                        .tag("result", result)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments the publish failure counter.
     */
    public void incrementPublishFailure(FailureCause cause) {
        failureCounters.computeIfAbsent(cause, k ->
                Counter.builder(prefix + "_publish_failures_total")
                        .description("Total number of failed publish attempts")
                        .tag("cause", cause.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records the size of a payload handed to the broker.
     */
    public void recordPayloadSize(int bytes) {
        payloadSizes.record(bytes);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
