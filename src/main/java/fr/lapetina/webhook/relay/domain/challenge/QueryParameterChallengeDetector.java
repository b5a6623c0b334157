package fr.lapetina.webhook.relay.domain.challenge;

import fr.lapetina.webhook.relay.domain.model.HandlerResponse;
import fr.lapetina.webhook.relay.domain.model.IncomingRequest;

import java.util.Optional;

/**
 * Detects a challenge token sent as a query parameter (e.g. {@code hub.challenge}) and echoes it.
 */
public final class QueryParameterChallengeDetector implements ChallengeDetector {

    private final String parameter;

    public QueryParameterChallengeDetector(String parameter) {
        this.parameter = parameter;
    }

    @Override
    public String getName() {
        return "query";
    }

    @Override
    public Optional<HandlerResponse> detect(IncomingRequest request) {
        String value = request.queryParameter(parameter);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(HandlerResponse.text(200, value));
    }

    @Override
    public String toString() {
        return "QueryParameterChallengeDetector{parameter=" + parameter + "}";
    }
}
