/**
 * Webhook Relay - Receives webhook calls and republishes their payloads to Google Cloud Pub/Sub.
 *
 * <p>Each accepted POST is checked against a source IP allow-list, answered directly when it is
 * a provider verification challenge, and otherwise forwarded verbatim to a single topic with a
 * bounded publish timeout.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.webhook.relay.RelayFactory} - Builds a fully-wired handler from YAML
 *       configuration and environment variables</li>
 *   <li>{@link fr.lapetina.webhook.relay.WebhookRelayApplication} - Standalone HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (RelayFactory factory = RelayFactory.create("webhook-relay.yaml")) {
 *     WebhookHandler handler = factory.getWebhookHandler();
 *
 *     HandlerResponse response = handler.handle(IncomingRequest.builder()
 *             .method("POST")
 *             .body("{\"event\":\"x\"}".getBytes(StandardCharsets.UTF_8))
 *             .build());
 *     System.out.println(response.statusCode());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>IPv4 and IPv6 CIDR allow-list with proxy header support</li>
 *   <li>Pluggable challenge detection (JSON field, header, query parameter)</li>
 *   <li>Degraded mode instead of crashing on incomplete configuration</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.webhook.relay.handler.WebhookHandler
 * @see fr.lapetina.webhook.relay.infrastructure.pubsub.PublisherGateway
 */
package fr.lapetina.webhook.relay;
