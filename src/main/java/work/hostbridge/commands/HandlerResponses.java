package work.hostbridge.commands;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handler-level result payloads. Domain failures are reported as {@code success=false} inside a successful
 * envelope rather than thrown.
 */
public final class HandlerResponses {
    private HandlerResponses() {}

    public static Map<String, Object> success(String message) {
        return success(message, null);
    }

    public static Map<String, Object> success(String message, Object data) {
        var map = new LinkedHashMap<String, Object>();
        map.put("success", true);
        map.put("message", message);
        if (data != null) {
            map.put("data", data);
        }
        return map;
    }

    public static Map<String, Object> error(String message) {
        return error(message, null);
    }

    public static Map<String, Object> error(String message, Object data) {
        var map = new LinkedHashMap<String, Object>();
        map.put("success", false);
        map.put("error", message);
        if (data != null) {
            map.put("data", data);
        }
        return map;
    }
}
