package fr.lapetina.webhook.relay.domain.challenge;

import fr.lapetina.webhook.relay.domain.model.HandlerResponse;
import fr.lapetina.webhook.relay.domain.model.IncomingRequest;

import java.util.Optional;

/**
 * Recognizes provider verification handshakes that must be answered instead of published.
 *
 * Implementations must be thread-safe as they are called from concurrent request threads.
 */
public interface ChallengeDetector {

    /**
     * Returns the name of this detector for configuration and logging.
     */
    String getName();

    /**
     * Inspects the request.
     *
     * @param request The inbound webhook call
     * @return The response echoing the challenge, or empty if the request is a regular event
     */
    Optional<HandlerResponse> detect(IncomingRequest request);
}
