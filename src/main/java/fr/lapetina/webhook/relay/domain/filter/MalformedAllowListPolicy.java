package fr.lapetina.webhook.relay.domain.filter;

/**
 * What to do when an allow-list was configured but none of its entries could be parsed.
 */
public enum MalformedAllowListPolicy {
    /** Behave as if no allow-list was configured */
    PERMIT_ALL,

    /** Reject every caller until the configuration is fixed */
    DENY_ALL
}
