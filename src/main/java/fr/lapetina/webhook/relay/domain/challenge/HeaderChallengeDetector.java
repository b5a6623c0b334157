package fr.lapetina.webhook.relay.domain.challenge;

import fr.lapetina.webhook.relay.domain.model.HandlerResponse;
import fr.lapetina.webhook.relay.domain.model.IncomingRequest;

import java.util.Optional;

/**
 * Detects a challenge token sent in a request header and echoes it as plain text.
 */
public final class HeaderChallengeDetector implements ChallengeDetector {

    private final String headerName;

    public HeaderChallengeDetector(String headerName) {
        this.headerName = headerName;
    }

    @Override
    public String getName() {
        return "header";
    }

    @Override
    public Optional<HandlerResponse> detect(IncomingRequest request) {
        String value = request.header(headerName);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(HandlerResponse.text(200, value.trim()));
    }

    @Override
    public String toString() {
        return "HeaderChallengeDetector{header=" + headerName + "}";
    }
}
