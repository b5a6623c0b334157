package fr.lapetina.webhook.relay.domain.model;

import java.util.Objects;

/**
 * Result of a single publish attempt: either the broker-assigned message id,
 * or a failure cause with a detail string meant for server-side logs only.
 */
public record PublishOutcome(
        String messageId,
        FailureCause failureCause,
        String failureDetail
) {
    public PublishOutcome {
        if (failureCause == null) {
            Objects.requireNonNull(messageId, "Message ID is required for a successful outcome");
        }
    }

    public static PublishOutcome success(String messageId) {
        return new PublishOutcome(messageId, null, null);
    }

    public static PublishOutcome failure(FailureCause cause, String detail) {
        return new PublishOutcome(null, Objects.requireNonNull(cause, "Failure cause is required"), detail);
    }

    public boolean isSuccess() {
        return failureCause == null;
    }

    public boolean isFailure() {
        return failureCause != null;
    }
}
