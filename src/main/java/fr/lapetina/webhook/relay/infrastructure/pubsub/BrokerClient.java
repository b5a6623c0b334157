package fr.lapetina.webhook.relay.infrastructure.pubsub;

import fr.lapetina.webhook.relay.domain.model.TopicPath;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Long-lived handle to the publish/subscribe broker.
 *
 * Implementations must be safe for concurrent use; one instance serves every request.
 */
public interface BrokerClient extends AutoCloseable {

    /**
     * Starts publishing one message.
     *
     * @param topic      Destination topic
     * @param payload    Message data, forwarded unmodified
     * @param attributes Message attributes, may be empty
     * @return Future completing with the broker-assigned message id, or exceptionally
     *         with a {@link BrokerException}
     */
    CompletableFuture<String> publish(TopicPath topic, byte[] payload, Map<String, String> attributes);

    @Override
    void close();
}
