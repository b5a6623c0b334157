package fr.lapetina.webhook.relay.domain.challenge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.webhook.relay.domain.model.HandlerResponse;
import fr.lapetina.webhook.relay.domain.model.IncomingRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Detects a challenge carried as a top-level field of a JSON body,
 * e.g. {@code {"type":"url_verification","challenge":"abc123"}}.
 *
 * <p>Only bodies declared as JSON (or without a content type) are inspected. A body that does
 * not parse is treated as a regular event.
 */
public final class JsonFieldChallengeDetector implements ChallengeDetector {

    private static final Logger log = LoggerFactory.getLogger(JsonFieldChallengeDetector.class);

    private final ObjectMapper objectMapper;
    private final String field;
    private final EchoMode echoMode;

    public JsonFieldChallengeDetector(ObjectMapper objectMapper, String field, EchoMode echoMode) {
        this.objectMapper = objectMapper;
        this.field = field;
        this.echoMode = echoMode;
    }

    public JsonFieldChallengeDetector(String field) {
        this(new ObjectMapper(), field, EchoMode.DOCUMENT);
    }

    @Override
    public String getName() {
        return "json-field";
    }

    @Override
    public Optional<HandlerResponse> detect(IncomingRequest request) {
        if (request.bodySize() == 0 || !isJson(request.contentType())) {
            return Optional.empty();
        }

        byte[] body = request.body();
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            log.debug("Body is not valid JSON, skipping challenge check: {}", e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        if (log.isDebugEnabled()) {
            List<String> keys = new ArrayList<>();
            root.fieldNames().forEachRemaining(keys::add);
            log.debug("Received JSON with keys: {}", keys);
        }

        JsonNode token = root.get(field);
        if (token == null || !token.isValueNode() || token.isNull() || token.asText().isBlank()) {
            return Optional.empty();
        }

        if (echoMode == EchoMode.VALUE) {
            return Optional.of(HandlerResponse.text(200, token.asText()));
        }
        return Optional.of(HandlerResponse.json(200, body));
    }

    private static boolean isJson(String contentType) {
        return contentType == null || contentType.toLowerCase().contains("json");
    }

    @Override
    public String toString() {
        return "JsonFieldChallengeDetector{field=" + field + ", echo=" + echoMode + "}";
    }
}
