/**
 * Detection of provider verification handshakes ("challenges").
 *
 * <p>Some webhook providers send a verification request before enabling delivery and expect a
 * token echoed back. Such requests are answered directly and never published.
 *
 * <h2>Available Detectors</h2>
 * <table border="1">
 *   <tr><th>Type</th><th>Looks at</th><th>Echoes</th></tr>
 *   <tr><td>{@code json-field}</td><td>Top-level field of a JSON body</td><td>The document, or the bare token</td></tr>
 *   <tr><td>{@code header}</td><td>A request header</td><td>The header value</td></tr>
 *   <tr><td>{@code query}</td><td>A query parameter</td><td>The parameter value</td></tr>
 * </table>
 *
 * <h2>Custom Detectors</h2>
 * <p>Implement {@link fr.lapetina.webhook.relay.domain.challenge.ChallengeDetector} and register
 * with {@link fr.lapetina.webhook.relay.domain.challenge.ChallengeDetectorFactory}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ChallengeDetector detector = ChallengeDetectorFactory
 *         .create(new ChallengeRule("json-field", "challenge", EchoMode.VALUE))
 *         .orElseThrow();
 * Optional<HandlerResponse> reply = detector.detect(request);
 * }</pre>
 */
package fr.lapetina.webhook.relay.domain.challenge;
