package fr.lapetina.webhook.relay.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import fr.lapetina.webhook.relay.domain.challenge.ChallengeDetector;
import fr.lapetina.webhook.relay.domain.filter.AllowList;
import fr.lapetina.webhook.relay.domain.filter.ClientIpResolver;
import fr.lapetina.webhook.relay.domain.model.HandlerResponse;
import fr.lapetina.webhook.relay.domain.model.IncomingRequest;
import fr.lapetina.webhook.relay.domain.model.PublishOutcome;
import fr.lapetina.webhook.relay.domain.model.RequestOutcome;
import fr.lapetina.webhook.relay.infrastructure.metrics.RelayMetrics;
import fr.lapetina.webhook.relay.infrastructure.pubsub.PublisherGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns one webhook call into at most one published message.
 *
 * Steps, each of which may end the request:
 * 1. Startup check - degraded process answers 500
 * 2. Method check - anything but POST answers 405
 * 3. IP filter - only with a restricting allow-list; unknown or disallowed caller answers 403
 * 4. Challenge check - verification handshakes are echoed with 200, never published
 * 5. Publish - raw body forwarded; 200 with the message id, 502/500 on failure
 *
 * Stateless per request and safe for concurrent use. Never throws: unexpected errors
 * answer 500. Payloads and headers are never logged, only sizes and a digest.
 */
public final class WebhookHandler {

    private static final Logger log = LoggerFactory.getLogger(WebhookHandler.class);

    static final String ATTRIBUTE_PATH = "webhook-path";
    static final String ATTRIBUTE_CONTENT_TYPE = "content-type";

    private final String configurationProblem;
    private final AllowList allowList;
    private final ClientIpResolver ipResolver;
    private final List<ChallengeDetector> challengeDetectors;
    private final PublisherGateway gateway;
    private final boolean publishAttributes;
    private final RelayMetrics metrics;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WebhookHandler(
            AllowList allowList,
            ClientIpResolver ipResolver,
            List<ChallengeDetector> challengeDetectors,
            PublisherGateway gateway,
            boolean publishAttributes,
            RelayMetrics metrics
    ) {
        this(null,
                Objects.requireNonNull(allowList, "Allow-list is required"),
                Objects.requireNonNull(ipResolver, "IP resolver is required"),
                List.copyOf(challengeDetectors),
                Objects.requireNonNull(gateway, "Publisher gateway is required"),
                publishAttributes,
                metrics);
    }

    private WebhookHandler(
            String configurationProblem,
            AllowList allowList,
            ClientIpResolver ipResolver,
            List<ChallengeDetector> challengeDetectors,
            PublisherGateway gateway,
            boolean publishAttributes,
            RelayMetrics metrics
    ) {
        this.configurationProblem = configurationProblem;
        this.allowList = allowList;
        this.ipResolver = ipResolver;
        this.challengeDetectors = challengeDetectors;
        this.gateway = gateway;
        this.publishAttributes = publishAttributes;
        this.metrics = metrics;
    }

    /**
     * Creates a handler for a process that cannot serve requests: every call answers 500.
     *
     * @param reason Logged with each rejected request, never sent to the caller
     */
    public static WebhookHandler degraded(String reason, RelayMetrics metrics) {
        return new WebhookHandler(
                Objects.requireNonNull(reason, "Reason is required"),
                AllowList.permitAll(),
                new ClientIpResolver(),
                List.of(),
                null,
                false,
                metrics
        );
    }

    public boolean isDegraded() {
        return configurationProblem != null;
    }

    /**
     * Returns why this handler rejects every request, or null when it serves normally.
     */
    public String getConfigurationProblem() {
        return configurationProblem;
    }

    /**
     * Handles one webhook call.
     */
    public HandlerResponse handle(IncomingRequest request) {
        String clientIp = "";
        try {
            clientIp = ipResolver.resolve(request);
            return process(request, clientIp);
        } catch (RuntimeException e) {
            log.error("Unexpected error handling webhook: method={}, path={}, clientIp={}",
                    request.method(), request.path(), display(clientIp), e);
            return finish(request, clientIp, RequestOutcome.INTERNAL_ERROR,
                    HandlerResponse.text(500, "Internal server error"));
        }
    }

    private HandlerResponse process(IncomingRequest request, String clientIp) {
        // 1. Startup check
        if (configurationProblem != null) {
            log.error("Rejecting request, relay is not configured: {}", configurationProblem);
            return finish(request, clientIp, RequestOutcome.CONFIGURATION_ERROR,
                    HandlerResponse.text(500, "Configuration error"));
        }

        // 2. Method check
        if (!request.isPost()) {
            log.warn("Invalid method: {}", request.method());
            return finish(request, clientIp, RequestOutcome.METHOD_NOT_ALLOWED,
                    HandlerResponse.text(405, "Method not allowed").withHeader("Allow", "POST"));
        }

        // 3. IP filter
        if (allowList.isRestricted()) {
            if (clientIp.isEmpty()) {
                log.warn("Cannot verify origin: no client IP found in request");
                return finish(request, clientIp, RequestOutcome.ORIGIN_REJECTED,
                        HandlerResponse.text(403, "Forbidden"));
            }
            if (!allowList.permits(clientIp)) {
                log.warn("IP {} not in allow-list", clientIp);
                return finish(request, clientIp, RequestOutcome.ORIGIN_REJECTED,
                        HandlerResponse.text(403, "Forbidden"));
            }
            log.debug("IP {} in allow-list", clientIp);
        }

        // 4. Challenge check
        for (ChallengeDetector detector : challengeDetectors) {
            Optional<HandlerResponse> reply = detector.detect(request);
            if (reply.isPresent()) {
                log.info("Responding to challenge request: detector={}", detector.getName());
                return finish(request, clientIp, RequestOutcome.CHALLENGE_HANDLED, reply.get());
            }
        }

        // 5. Publish
        return publish(request, clientIp);
    }

    private HandlerResponse publish(IncomingRequest request, String clientIp) {
        byte[] payload = request.body();
        if (metrics != null) {
            metrics.recordPayloadSize(payload.length);
        }
        log.info("Publishing to topic: topic={}, bytes={}, sha256={}",
                gateway.getTopic(), payload.length, digest(payload));

        PublishOutcome outcome = gateway.publish(payload, attributes(request, payload.length == 0));

        if (outcome.isSuccess()) {
            log.info("Published message: messageId={}", outcome.messageId());
            return finish(request, clientIp, RequestOutcome.PUBLISHED, acknowledge(outcome.messageId()));
        }

        log.error("Error publishing message: cause={}, detail={}", outcome.failureCause(), outcome.failureDetail());
        if (outcome.failureCause().isUpstream()) {
            return finish(request, clientIp, RequestOutcome.UPSTREAM_FAILURE,
                    HandlerResponse.text(502, "Failed to process webhook"));
        }
        return finish(request, clientIp, RequestOutcome.PUBLISH_FAILED,
                HandlerResponse.text(500, "Failed to process webhook"));
    }

    // Pub/Sub rejects a message with neither data nor attributes.
    private Map<String, String> attributes(IncomingRequest request, boolean emptyPayload) {
        if (!publishAttributes) {
            return emptyPayload ? Map.of(ATTRIBUTE_PATH, request.path()) : Map.of();
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(ATTRIBUTE_PATH, request.path());
        String contentType = request.contentType();
        if (contentType != null && !contentType.isBlank()) {
            attributes.put(ATTRIBUTE_CONTENT_TYPE, contentType);
        }
        return attributes;
    }

    private HandlerResponse acknowledge(String messageId) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "OK");
        body.put("messageId", messageId);
        try {
            return HandlerResponse.json(200, objectMapper.writeValueAsBytes(body));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize acknowledgement for message {}", messageId, e);
            return HandlerResponse.text(200, "OK");
        }
    }

    private HandlerResponse finish(
            IncomingRequest request,
            String clientIp,
            RequestOutcome outcome,
            HandlerResponse response
    ) {
        if (metrics != null) {
            metrics.incrementRequestCount(outcome);
        }
        log.info("Webhook handled: method={}, path={}, clientIp={}, outcome={}, status={}",
                request.method(), request.path(), display(clientIp), outcome, response.statusCode());
        return response;
    }

    private static String digest(byte[] payload) {
        return Hashing.sha256().hashBytes(payload).toString().substring(0, 16);
    }

    private static String display(String clientIp) {
        return clientIp == null || clientIp.isEmpty() ? "unknown" : clientIp;
    }
}
