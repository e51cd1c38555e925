package work.hostbridge.commands;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import work.hostbridge.registry.CommandHandler;
import work.hostbridge.registry.CommandUnit;
import work.hostbridge.registry.HandlerResult;

/**
 * Reads or clears the editor console.
 */
public final class ReadConsole implements CommandUnit {
    private final EditorHost host;

    public ReadConsole(EditorHost host) {
        this.host = Objects.requireNonNull(host, "host");
    }

    @Override
    public CommandHandler handler() {
        return params -> HandlerResult.immediate(handle(params));
    }

    Map<String, Object> handle(Map<String, Object> params) {
        String action = Params.string(params, "action");
        action = action == null ? "get" : action.toLowerCase(Locale.ROOT);
        if ("clear".equals(action)) {
            host.clearConsole();
            return HandlerResponses.success("Console cleared successfully.");
        }
        if (!"get".equals(action)) {
            return HandlerResponses.error("Invalid action '" + action + "'. Must be 'get' or 'clear'.");
        }

        List<String> types = Params.strings(params, "types");
        List<Map<String, Object>> entries = new ArrayList<>();
        for (EditorHost.ConsoleEntry entry : host.console()) {
            if (!types.isEmpty() && !types.contains("all") && !types.contains(entry.type().wireName())) {
                continue;
            }
            var item = new LinkedHashMap<String, Object>();
            item.put("type", entry.type().wireName());
            item.put("message", entry.message());
            item.put("timestamp", entry.timestamp().toString());
            entries.add(item);
        }
        Integer count = Params.integer(params, "count");
        if (count != null && count >= 0 && entries.size() > count) {
            entries = new ArrayList<>(entries.subList(entries.size() - count, entries.size()));
        }
        return HandlerResponses.success("Retrieved " + entries.size() + " log entries.", entries);
    }
}
