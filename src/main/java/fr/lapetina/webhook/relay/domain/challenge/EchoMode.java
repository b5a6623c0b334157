package fr.lapetina.webhook.relay.domain.challenge;

/**
 * How a detected challenge is echoed back to the provider.
 */
public enum EchoMode {
    /** Return the received JSON document unchanged */
    DOCUMENT,

    /** Return only the challenge token as plain text */
    VALUE
}
