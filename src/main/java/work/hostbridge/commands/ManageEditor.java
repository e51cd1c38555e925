package work.hostbridge.commands;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import work.hostbridge.registry.CommandHandler;
import work.hostbridge.registry.CommandUnit;
import work.hostbridge.registry.HandlerResult;

/**
 * Play mode control, tool selection and tag/layer management.
 */
public final class ManageEditor implements CommandUnit {
    private static final String SUPPORTED_ACTIONS =
        "play, pause, stop, get_state, set_active_tool, add_tag, remove_tag, add_layer, remove_layer";

    private final EditorHost host;

    public ManageEditor(EditorHost host) {
        this.host = Objects.requireNonNull(host, "host");
    }

    @Override
    public String commandName() {
        return "manage_editor";
    }

    @Override
    public CommandHandler handler() {
        return params -> HandlerResult.immediate(handle(params));
    }

    Map<String, Object> handle(Map<String, Object> params) {
        String action = Params.string(params, "action");
        if (action == null) {
            return HandlerResponses.error("Action parameter is required.");
        }
        String tagName = Params.string(params, "tagName");
        String layerName = Params.string(params, "layerName");
        switch (action.toLowerCase(Locale.ROOT)) {
            case "play":
                if (!host.isPlaying()) {
                    host.setPlaying(true);
                    return HandlerResponses.success("Entered play mode.");
                }
                return HandlerResponses.success("Already in play mode.");
            case "pause":
                if (!host.isPlaying()) {
                    return HandlerResponses.error("Cannot pause/resume: Not in play mode.");
                }
                host.setPaused(!host.isPaused());
                return HandlerResponses.success(host.isPaused() ? "Game paused." : "Game resumed.");
            case "stop":
                if (host.isPlaying()) {
                    host.setPlaying(false);
                    return HandlerResponses.success("Exited play mode.");
                }
                return HandlerResponses.success("Already stopped (not in play mode).");
            case "get_state":
                return HandlerResponses.success("Retrieved editor state.", state());
            case "set_active_tool":
                return setActiveTool(Params.string(params, "toolName"));
            case "add_tag":
                if (tagName == null) {
                    return HandlerResponses.error("'tagName' parameter required for add_tag.");
                }
                return addTag(tagName);
            case "remove_tag":
                if (tagName == null) {
                    return HandlerResponses.error("'tagName' parameter required for remove_tag.");
                }
                return removeTag(tagName);
            case "add_layer":
                if (layerName == null) {
                    return HandlerResponses.error("'layerName' parameter required for add_layer.");
                }
                return addLayer(layerName);
            case "remove_layer":
                if (layerName == null) {
                    return HandlerResponses.error("'layerName' parameter required for remove_layer.");
                }
                return removeLayer(layerName);
            default:
                return HandlerResponses.error(
                    "Unknown action: '" + action + "'. Supported actions: " + SUPPORTED_ACTIONS + "."
                );
        }
    }

    private Map<String, Object> state() {
        var state = new LinkedHashMap<String, Object>();
        state.put("playing", host.isPlaying());
        state.put("paused", host.isPaused());
        state.put("activeTool", host.activeTool());
        return state;
    }

    private Map<String, Object> setActiveTool(String toolName) {
        if (toolName == null) {
            return HandlerResponses.error("'toolName' parameter required for set_active_tool.");
        }
        String selected = host.selectTool(toolName);
        if (selected == null) {
            return HandlerResponses.error(
                "Could not parse '" + toolName + "' as a standard tool. Valid tools: " + String.join(", ", EditorHost.TOOLS) + "."
            );
        }
        return HandlerResponses.success("Set active tool to '" + selected + "'.");
    }

    private Map<String, Object> addTag(String tagName) {
        if (!host.addTag(tagName)) {
            return HandlerResponses.error("Tag '" + tagName + "' already exists.");
        }
        return HandlerResponses.success("Tag '" + tagName + "' added successfully.");
    }

    private Map<String, Object> removeTag(String tagName) {
        if (EditorHost.BUILT_IN_TAGS.contains(tagName)) {
            return HandlerResponses.error("Cannot remove built-in tag '" + tagName + "'.");
        }
        if (!host.removeTag(tagName)) {
            return HandlerResponses.error("Tag '" + tagName + "' does not exist.");
        }
        return HandlerResponses.success("Tag '" + tagName + "' removed successfully.");
    }

    private Map<String, Object> addLayer(String layerName) {
        int existing = host.indexOfLayer(layerName);
        if (existing >= 0) {
            return HandlerResponses.error("Layer '" + layerName + "' already exists at index " + existing + ".");
        }
        for (int i = EditorHost.FIRST_USER_LAYER; i < EditorHost.LAYER_COUNT; i++) {
            if (host.layerAt(i) == null) {
                host.setLayer(i, layerName);
                return HandlerResponses.success(
                    "Layer '" + layerName + "' added to slot " + i + ".",
                    Map.of("layerName", layerName, "index", i)
                );
            }
        }
        return HandlerResponses.error("No empty User Layer slots available (8-31 are all filled).");
    }

    private Map<String, Object> removeLayer(String layerName) {
        int index = host.indexOfLayer(layerName);
        if (index < EditorHost.FIRST_USER_LAYER) {
            return HandlerResponses.error("User layer '" + layerName + "' not found.");
        }
        host.setLayer(index, null);
        return HandlerResponses.success("Layer '" + layerName + "' (slot " + index + ") removed successfully.");
    }
}
