package fr.lapetina.webhook.relay.infrastructure.pubsub;

import fr.lapetina.webhook.relay.domain.model.FailureCause;

/**
 * Broker-reported publish failure, already classified.
 */
public class BrokerException extends RuntimeException {

    private final FailureCause failureCause;

    public BrokerException(FailureCause failureCause, String message) {
        super(message);
        this.failureCause = failureCause;
    }

    public BrokerException(FailureCause failureCause, String message, Throwable cause) {
        super(message, cause);
        this.failureCause = failureCause;
    }

    public FailureCause getFailureCause() {
        return failureCause;
    }
}
