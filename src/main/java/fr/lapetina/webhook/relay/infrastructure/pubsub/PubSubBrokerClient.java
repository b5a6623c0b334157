package fr.lapetina.webhook.relay.infrastructure.pubsub;

import com.google.api.core.ApiFuture;
import com.google.api.core.ApiFutureCallback;
import com.google.api.core.ApiFutures;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.google.cloud.pubsub.v1.Publisher;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.protobuf.ByteString;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.TopicName;
import fr.lapetina.webhook.relay.domain.model.FailureCause;
import fr.lapetina.webhook.relay.domain.model.TopicPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Google Cloud Pub/Sub implementation of {@link BrokerClient}.
 *
 * <p>Wraps a single {@link Publisher}, which is bound to one topic and is thread-safe.
 * Publishing to any other topic fails with {@link FailureCause#UNKNOWN}.
 */
public final class PubSubBrokerClient implements BrokerClient {

    private static final Logger log = LoggerFactory.getLogger(PubSubBrokerClient.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final TopicPath topic;
    private final Publisher publisher;

    PubSubBrokerClient(TopicPath topic, Publisher publisher) {
        this.topic = topic;
        this.publisher = publisher;
    }

    /**
     * Creates a publisher for the topic using application default credentials.
     */
    public static PubSubBrokerClient create(TopicPath topic) throws IOException {
        Publisher publisher = Publisher.newBuilder(TopicName.of(topic.project(), topic.topic())).build();
        log.info("Pub/Sub publisher created for topic: {}", topic);
        return new PubSubBrokerClient(topic, publisher);
    }

    @Override
    public CompletableFuture<String> publish(TopicPath target, byte[] payload, Map<String, String> attributes) {
        if (!topic.equals(target)) {
            return CompletableFuture.failedFuture(new BrokerException(FailureCause.UNKNOWN,
                    "Publisher is bound to " + topic + ", cannot publish to " + target));
        }

        PubsubMessage message = PubsubMessage.newBuilder()
                .setData(ByteString.copyFrom(payload))
                .putAllAttributes(attributes)
                .build();

        CompletableFuture<String> result = new CompletableFuture<>();
        ApiFuture<String> future = publisher.publish(message);
        ApiFutures.addCallback(future, new ApiFutureCallback<>() {
            @Override
            public void onSuccess(String messageId) {
                result.complete(messageId);
            }

            @Override
            public void onFailure(Throwable t) {
                result.completeExceptionally(classify(t));
            }
        }, MoreExecutors.directExecutor());
        return result;
    }

    static BrokerException classify(Throwable t) {
        if (t instanceof ApiException) {
            ApiException apiException = (ApiException) t;
            StatusCode.Code code = apiException.getStatusCode().getCode();
            FailureCause cause = code == StatusCode.Code.INVALID_ARGUMENT
                    ? FailureCause.INVALID_PAYLOAD
                    : FailureCause.BROKER_UNAVAILABLE;
            return new BrokerException(cause, "Pub/Sub returned " + code + ": " + t.getMessage(), t);
        }
        return new BrokerException(FailureCause.UNKNOWN, "Pub/Sub publish failed: " + t, t);
    }

    @Override
    public void close() {
        log.info("Shutting down Pub/Sub publisher for topic: {}", topic);
        publisher.shutdown();
        try {
            if (!publisher.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Pub/Sub publisher did not terminate within {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
