package work.hostbridge.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validation and parsing of raw command text into {@link CommandEnvelope}s.
 */
public final class CommandEnvelopes {
    static final ObjectMapper JSON = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_REF = new TypeReference<>() {};
    private static final int ECHO_LIMIT = 50;

    private CommandEnvelopes() {}

    /**
     * Whether {@code text} is the bare liveness probe, ignoring case and surrounding whitespace.
     */
    public static boolean isPing(String text) {
        return text != null && CommandEnvelope.isPing(text.trim());
    }

    /**
     * True only for a single syntactically valid JSON object or array.
     */
    public static boolean isValidJson(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String trimmed = text.trim();
        boolean object = trimmed.startsWith("{") && trimmed.endsWith("}");
        boolean array = trimmed.startsWith("[") && trimmed.endsWith("]");
        if (!object && !array) {
            return false;
        }
        try {
            JSON.readTree(trimmed);
            return true;
        } catch (JsonProcessingException ex) {
            return false;
        }
    }

    /**
     * Parses envelope text that already passed {@link #isValidJson(String)}.
     *
     * @throws MalformedCommandException when the JSON is not an object or {@code params} is not an object
     */
    public static CommandEnvelope parse(String text) {
        JsonNode root;
        try {
            root = JSON.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new MalformedCommandException("Invalid JSON format: " + ex.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new MalformedCommandException("Command must be a JSON object");
        }
        JsonNode typeNode = root.get("type");
        String type = typeNode == null || typeNode.isNull() ? null : typeNode.asText();
        JsonNode paramsNode = root.get("params");
        Map<String, Object> params;
        if (paramsNode == null || paramsNode.isNull()) {
            params = new LinkedHashMap<>();
        } else if (paramsNode.isObject()) {
            params = JSON.convertValue(paramsNode, MAP_REF);
        } else {
            throw new MalformedCommandException("Command params must be a JSON object");
        }
        return new CommandEnvelope(type, params);
    }

    /**
     * Bounded echo of offending input for error payloads.
     */
    public static String truncate(String text) {
        if (text == null || text.length() <= ECHO_LIMIT) {
            return text;
        }
        return text.substring(0, ECHO_LIMIT) + "...";
    }
}
