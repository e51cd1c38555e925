package work.hostbridge.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the JSON response envelopes returned to transports.
 */
public final class ResponseEnvelopes {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    private static final String PONG = "{\"status\":\"success\",\"result\":{\"message\":\"pong\"}}";

    private ResponseEnvelopes() {}

    public static String pong() {
        return PONG;
    }

    public static String success(Object result) {
        var envelope = new LinkedHashMap<String, Object>();
        envelope.put("status", STATUS_SUCCESS);
        envelope.put("result", result);
        try {
            return CommandEnvelopes.JSON.writeValueAsString(envelope);
        } catch (JsonProcessingException ex) {
            return error("Failed to serialize command result: " + ex.getOriginalMessage(), null, null);
        }
    }

    public static String error(String message, String command) {
        return error(message, command, null);
    }

    public static String error(String message, String command, String stackTrace) {
        var envelope = new LinkedHashMap<String, Object>();
        envelope.put("status", STATUS_ERROR);
        envelope.put("error", message);
        envelope.put("command", command);
        if (stackTrace != null) {
            envelope.put("stackTrace", stackTrace);
        }
        return write(envelope);
    }

    public static String invalidJson(String receivedText) {
        var envelope = new LinkedHashMap<String, Object>();
        envelope.put("status", STATUS_ERROR);
        envelope.put("error", "Invalid JSON format");
        envelope.put("command", null);
        envelope.put("receivedText", CommandEnvelopes.truncate(receivedText));
        return write(envelope);
    }

    /**
     * Error envelope carrying the failure's message and stack trace.
     */
    public static String failure(Throwable error, String command) {
        return error(messageOf(error), command, stackTraceOf(error));
    }

    public static String messageOf(Throwable error) {
        if (error == null) {
            return "Unexpected error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    static String stackTraceOf(Throwable error) {
        if (error == null) {
            return null;
        }
        var out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    private static String write(Map<String, Object> envelope) {
        try {
            return CommandEnvelopes.JSON.writeValueAsString(envelope);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize response envelope", ex);
        }
    }
}
