package fr.lapetina.webhook.relay.infrastructure.pubsub;

import fr.lapetina.webhook.relay.domain.model.FailureCause;
import fr.lapetina.webhook.relay.domain.model.PublishOutcome;
import fr.lapetina.webhook.relay.domain.model.TopicPath;
import fr.lapetina.webhook.relay.infrastructure.metrics.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounded-time publishing through the process-wide broker handle.
 *
 * <p>The handle is created by {@link #initialize()}, which is guarded so that concurrent or
 * repeated calls create it once. After that it is only read.
 *
 * <p>{@link #publish} makes exactly one attempt and never throws: every failure is returned
 * as a {@link PublishOutcome}. On timeout the broker future is abandoned, not cancelled;
 * a late completion is ignored.
 */
public final class PublisherGateway implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PublisherGateway.class);

    private final TopicPath topic;
    private final Duration timeout;
    private final BrokerClientFactory clientFactory;
    private final RelayMetrics metrics;

    private volatile BrokerClient client;

    public PublisherGateway(
            TopicPath topic,
            Duration timeout,
            BrokerClientFactory clientFactory,
            RelayMetrics metrics
    ) {
        this.topic = Objects.requireNonNull(topic, "Topic is required");
        this.timeout = Objects.requireNonNull(timeout, "Timeout is required");
        this.clientFactory = Objects.requireNonNull(clientFactory, "Client factory is required");
        this.metrics = metrics;
    }

    /**
     * Creates the broker handle if it does not exist yet.
     *
     * @return The single broker handle
     * @throws IOException if the broker client cannot be created
     */
    public synchronized BrokerClient initialize() throws IOException {
        if (client == null) {
            log.info("Initializing broker client for topic: {}", topic);
            client = Objects.requireNonNull(clientFactory.create(topic), "Client factory returned null");
        }
        return client;
    }

    public boolean isInitialized() {
        return client != null;
    }

    public TopicPath getTopic() {
        return topic;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Publishes to the configured topic.
     */
    public PublishOutcome publish(byte[] payload, Map<String, String> attributes) {
        return publish(topic, payload, attributes);
    }

    /**
     * Publishes one message, waiting at most the configured timeout.
     *
     * @param target     Destination topic
     * @param payload    Message data, forwarded unmodified
     * @param attributes Message attributes
     * @return Message id, or the classified failure
     */
    public PublishOutcome publish(TopicPath target, byte[] payload, Map<String, String> attributes) {
        BrokerClient current = client;
        if (current == null) {
            return record(PublishOutcome.failure(FailureCause.UNKNOWN, "Broker client is not initialized"), null);
        }

        Instant start = Instant.now();
        PublishOutcome outcome;
        try {
            CompletableFuture<String> future = current.publish(target, payload, attributes);
            String messageId = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            outcome = messageId != null
                    ? PublishOutcome.success(messageId)
                    : PublishOutcome.failure(FailureCause.UNKNOWN, "Broker returned no message id");
        } catch (TimeoutException e) {
            outcome = PublishOutcome.failure(FailureCause.TIMEOUT,
                    "Publish to " + target + " did not complete within " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            outcome = classify(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = PublishOutcome.failure(FailureCause.UNKNOWN, "Interrupted while waiting for broker");
        } catch (BrokerException e) {
            outcome = PublishOutcome.failure(e.getFailureCause(), e.getMessage());
        } catch (RuntimeException e) {
            outcome = PublishOutcome.failure(FailureCause.UNKNOWN, "Publish failed: " + e);
        }
        return record(outcome, Duration.between(start, Instant.now()));
    }

    private static PublishOutcome classify(Throwable cause) {
        if (cause instanceof BrokerException) {
            BrokerException brokerException = (BrokerException) cause;
            return PublishOutcome.failure(brokerException.getFailureCause(), brokerException.getMessage());
        }
        return PublishOutcome.failure(FailureCause.UNKNOWN, "Publish failed: " + cause);
    }

    private PublishOutcome record(PublishOutcome outcome, Duration latency) {
        if (metrics != null) {
            if (latency != null) {
                metrics.recordPublishLatency(latency, outcome.isSuccess());
            }
            if (outcome.isFailure()) {
                metrics.incrementPublishFailure(outcome.failureCause());
            }
        }
        return outcome;
    }

    @Override
    public void close() {
        BrokerClient current = client;
        if (current != null) {
            current.close();
        }
    }
}
