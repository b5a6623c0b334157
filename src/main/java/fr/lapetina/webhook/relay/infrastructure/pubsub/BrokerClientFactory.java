package fr.lapetina.webhook.relay.infrastructure.pubsub;

import fr.lapetina.webhook.relay.domain.model.TopicPath;

import java.io.IOException;

/**
 * Creates the broker handle for a topic. Called at most once per process.
 */
@FunctionalInterface
public interface BrokerClientFactory {

    BrokerClient create(TopicPath topic) throws IOException;
}
