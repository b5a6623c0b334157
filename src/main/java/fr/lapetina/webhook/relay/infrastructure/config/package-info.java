/**
 * Configuration loading and validation.
 *
 * <p>This package handles YAML configuration parsing, environment overrides and the one-time
 * validation into an immutable settings value.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.webhook.relay.infrastructure.config.RelayConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.webhook.relay.infrastructure.config.ConfigLoader} - YAML loading and environment overrides</li>
 *   <li>{@link fr.lapetina.webhook.relay.infrastructure.config.RelaySettings} - Validated settings</li>
 * </ul>
 *
 * <h2>Environment Overrides</h2>
 * <ul>
 *   <li>{@code GCP_PROJECT} - {@code pubsub.project} (required)</li>
 *   <li>{@code TOPIC_NAME} - {@code pubsub.topicName} (required)</li>
 *   <li>{@code TOPIC_PROJECT} - {@code pubsub.topicProject}</li>
 *   <li>{@code IP_WHITELIST} - {@code allowList.ranges}, comma separated</li>
 *   <li>{@code PORT} - {@code server.port}</li>
 *   <li>{@code PUBLISH_TIMEOUT_MS} - {@code publish.timeoutMs}</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, path, worker threads)</li>
 *   <li>{@code pubsub} - Destination project and topic</li>
 *   <li>{@code publish} - Publish timeout and message attributes</li>
 *   <li>{@code allowList} - CIDR ranges, forwarding header, malformed-list policy</li>
 *   <li>{@code challenge} - Verification handshake detectors</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.webhook.relay.infrastructure.config.RelayConfig
 * @see fr.lapetina.webhook.relay.infrastructure.config.ConfigLoader
 */
package fr.lapetina.webhook.relay.infrastructure.config;
