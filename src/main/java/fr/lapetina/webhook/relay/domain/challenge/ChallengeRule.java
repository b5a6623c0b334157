package fr.lapetina.webhook.relay.domain.challenge;

import java.util.Objects;

/**
 * Configured challenge detector: its registered type, the field it inspects and how it echoes.
 */
public record ChallengeRule(String type, String field, EchoMode echo) {

    public ChallengeRule {
        Objects.requireNonNull(type, "Detector type is required");
        Objects.requireNonNull(field, "Challenge field is required");
        echo = echo != null ? echo : EchoMode.DOCUMENT;
    }
}
