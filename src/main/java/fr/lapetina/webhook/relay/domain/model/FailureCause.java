package fr.lapetina.webhook.relay.domain.model;

/**
 * Failure taxonomy for publish attempts.
 * Provides clear categorization for response mapping and metrics.
 */
public enum FailureCause {
    /** The broker did not acknowledge within the publish timeout */
    TIMEOUT,

    /** The broker reported an error (permission denied, topic not found, unavailable, etc.) */
    BROKER_UNAVAILABLE,

    /** The broker rejected the message itself */
    INVALID_PAYLOAD,

    /** Anything else, including a missing broker handle */
    UNKNOWN;

    /**
     * Whether the failure lies with the upstream broker rather than with this service.
     */
    public boolean isUpstream() {
        return this == TIMEOUT || this == BROKER_UNAVAILABLE;
    }
}
