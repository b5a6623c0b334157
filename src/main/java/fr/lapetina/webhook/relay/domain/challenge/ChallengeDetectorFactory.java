package fr.lapetina.webhook.relay.domain.challenge;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry of challenge detector types, so providers are selected by configuration
 * rather than hardcoded.
 */
public final class ChallengeDetectorFactory {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final Map<String, Function<ChallengeRule, ChallengeDetector>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("json-field", rule -> new JsonFieldChallengeDetector(OBJECT_MAPPER, rule.field(), rule.echo()));
        register("header", rule -> new HeaderChallengeDetector(rule.field()));
        register("query", rule -> new QueryParameterChallengeDetector(rule.field()));
    }

    private ChallengeDetectorFactory() {
        // Utility class
    }

    /**
     * Registers a custom detector type.
     *
     * @param type    Type name (used in configuration)
     * @param factory Creates a detector from its configured rule
     */
    public static void register(String type, Function<ChallengeRule, ChallengeDetector> factory) {
        REGISTRY.put(type.toLowerCase(), factory);
    }

    /**
     * Creates a detector for the rule.
     *
     * @return Detector instance, or empty if the type is unknown
     */
    public static Optional<ChallengeDetector> create(ChallengeRule rule) {
        Function<ChallengeRule, ChallengeDetector> factory = REGISTRY.get(rule.type().toLowerCase());
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.of(factory.apply(rule));
    }

    /**
     * Creates detectors for all rules, in order.
     *
     * @throws IllegalArgumentException if a rule names an unknown type
     */
    public static List<ChallengeDetector> createAll(List<ChallengeRule> rules) {
        List<ChallengeDetector> detectors = new ArrayList<>();
        for (ChallengeRule rule : rules) {
            detectors.add(create(rule).orElseThrow(() -> new IllegalArgumentException(
                    "Unknown challenge detector type: " + rule.type() + ". Available: " + getRegisteredNames())));
        }
        return List.copyOf(detectors);
    }

    /**
     * Returns all registered detector types.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
