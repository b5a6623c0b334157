/**
 * Core domain model for the webhook relay.
 *
 * <p>These types represent the request, publish result and response of a single webhook call.
 * All are immutable; nothing in this package outlives the request it belongs to.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.webhook.relay.domain.model.IncomingRequest} - The inbound call</li>
 *   <li>{@link fr.lapetina.webhook.relay.domain.model.PublishOutcome} - Message id or failure cause</li>
 *   <li>{@link fr.lapetina.webhook.relay.domain.model.HandlerResponse} - Status and body sent back</li>
 *   <li>{@link fr.lapetina.webhook.relay.domain.model.FailureCause} - Publish failure taxonomy</li>
 *   <li>{@link fr.lapetina.webhook.relay.domain.model.TopicPath} - Destination topic</li>
 * </ul>
 */
package fr.lapetina.webhook.relay.domain.model;
