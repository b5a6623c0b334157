package fr.lapetina.webhook.relay.domain.model;

/**
 * Terminal category of one webhook call, used for logging and metrics.
 */
public enum RequestOutcome {
    /** Required configuration was missing at startup */
    CONFIGURATION_ERROR,

    /** Anything but POST */
    METHOD_NOT_ALLOWED,

    /** Caller IP could not be determined or is not allowed */
    ORIGIN_REJECTED,

    /** Verification handshake answered without publishing */
    CHALLENGE_HANDLED,

    /** Payload published */
    PUBLISHED,

    /** Broker timed out or reported an error */
    UPSTREAM_FAILURE,

    /** Payload rejected by the broker, or publish failed for an unknown reason */
    PUBLISH_FAILED,

    /** Unexpected failure inside the relay */
    INTERNAL_ERROR
}
