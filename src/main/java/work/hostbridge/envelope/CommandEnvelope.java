package work.hostbridge.envelope;

import java.util.Map;

/**
 * Parsed inbound command: a routing {@code type} and its parameter bag.
 */
public record CommandEnvelope(String type, Map<String, Object> params) {
    public static final String PING = "ping";

    public CommandEnvelope {
        params = params == null ? Map.of() : params;
    }

    public boolean hasType() {
        return type != null && !type.isBlank();
    }

    public boolean isPing() {
        return isPing(type);
    }

    static boolean isPing(String text) {
        return PING.equalsIgnoreCase(text);
    }
}
