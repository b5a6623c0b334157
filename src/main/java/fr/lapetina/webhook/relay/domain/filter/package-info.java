/**
 * Source IP filtering.
 *
 * <p>{@link fr.lapetina.webhook.relay.domain.filter.ClientIpResolver} determines who is calling,
 * {@link fr.lapetina.webhook.relay.domain.filter.AllowList} decides whether that caller is permitted.
 * Both are pure and perform no DNS lookups.
 */
package fr.lapetina.webhook.relay.domain.filter;
