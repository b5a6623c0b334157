package fr.lapetina.webhook.relay.infrastructure.config;

import fr.lapetina.webhook.relay.domain.challenge.ChallengeRule;
import fr.lapetina.webhook.relay.domain.challenge.EchoMode;
import fr.lapetina.webhook.relay.domain.filter.AllowList;
import fr.lapetina.webhook.relay.domain.filter.MalformedAllowListPolicy;
import fr.lapetina.webhook.relay.domain.model.TopicPath;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Validated, immutable view of {@link RelayConfig}, built once at startup.
 *
 * @param topic             Destination topic
 * @param publishTimeout    Upper bound on a single broker round-trip
 * @param publishAttributes Whether request metadata is attached as message attributes
 * @param allowList         Parsed source IP allow-list
 * @param forwardedHeader   Header carrying the proxy chain
 * @param challengeRules    Challenge detectors to consult, empty if disabled
 */
public record RelaySettings(
        TopicPath topic,
        Duration publishTimeout,
        boolean publishAttributes,
        AllowList allowList,
        String forwardedHeader,
        List<ChallengeRule> challengeRules
) {
    public RelaySettings {
        challengeRules = List.copyOf(challengeRules);
    }

    /**
     * Validates the raw configuration.
     *
     * @throws ConfigLoader.ConfigurationException listing every missing or invalid setting
     */
    public static RelaySettings from(RelayConfig config) {
        List<String> missing = new ArrayList<>();
        RelayConfig.PubSubConfig pubsub = config.getPubsub();
        if (isBlank(pubsub.getProject())) {
            missing.add(ConfigLoader.ENV_GCP_PROJECT);
        }
        if (isBlank(pubsub.getTopicName())) {
            missing.add(ConfigLoader.ENV_TOPIC_NAME);
        }
        if (!missing.isEmpty()) {
            throw new ConfigLoader.ConfigurationException(
                    "Missing required configuration: " + String.join(", ", missing));
        }

        String topicProject = isBlank(pubsub.getTopicProject())
                ? pubsub.getProject().trim()
                : pubsub.getTopicProject().trim();
        TopicPath topic = new TopicPath(topicProject, pubsub.getTopicName().trim());

        long timeoutMs = config.getPublish().getTimeoutMs();
        if (timeoutMs <= 0) {
            throw new ConfigLoader.ConfigurationException("publish.timeoutMs must be positive: " + timeoutMs);
        }

        RelayConfig.AllowListConfig allowListConfig = config.getAllowList();
        AllowList allowList = AllowList.parse(
                allowListConfig.getRanges(),
                parseEnum(MalformedAllowListPolicy.class, allowListConfig.getMalformedPolicy(), "allowList.malformedPolicy")
        );

        List<ChallengeRule> rules = new ArrayList<>();
        if (config.getChallenge().isEnabled() && config.getChallenge().getDetectors() != null) {
            for (RelayConfig.DetectorConfig detector : config.getChallenge().getDetectors()) {
                if (isBlank(detector.getType()) || isBlank(detector.getField())) {
                    throw new ConfigLoader.ConfigurationException(
                            "Challenge detector requires both type and field");
                }
                rules.add(new ChallengeRule(
                        detector.getType().trim(),
                        detector.getField().trim(),
                        parseEnum(EchoMode.class, detector.getEcho(), "challenge.detectors.echo")
                ));
            }
        }

        String forwardedHeader = isBlank(allowListConfig.getForwardedHeader())
                ? "X-Forwarded-For"
                : allowListConfig.getForwardedHeader().trim();

        return new RelaySettings(
                topic,
                Duration.ofMillis(timeoutMs),
                config.getPublish().isAttributes(),
                allowList,
                forwardedHeader,
                rules
        );
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String key) {
        if (isBlank(value)) {
            return type.getEnumConstants()[0];
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoader.ConfigurationException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
