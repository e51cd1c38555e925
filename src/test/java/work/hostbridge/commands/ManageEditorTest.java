package work.hostbridge.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ManageEditorTest {
    private EditorHost host;
    private ManageEditor command;

    @BeforeEach
    void setUp() {
        host = new EditorHost();
        command = new ManageEditor(host);
    }

    private Map<String, Object> run(Map<String, Object> params) {
        return command.handle(params);
    }

    @Test
    void registersUnderExplicitName() {
        assertEquals("manage_editor", command.commandName());
    }

    @Test
    void requiresAction() {
        var result = run(Map.of());
        assertEquals(false, result.get("success"));
        assertEquals("Action parameter is required.", result.get("error"));
    }

    @Test
    void playPauseStopCycle() {
        assertEquals("Cannot pause/resume: Not in play mode.", run(Map.of("action", "pause")).get("error"));

        assertEquals("Entered play mode.", run(Map.of("action", "play")).get("message"));
        assertEquals("Already in play mode.", run(Map.of("action", "PLAY")).get("message"));
        assertEquals("Game paused.", run(Map.of("action", "pause")).get("message"));
        assertTrue(host.isPaused());
        assertEquals("Game resumed.", run(Map.of("action", "pause")).get("message"));

        assertEquals("Exited play mode.", run(Map.of("action", "stop")).get("message"));
        assertFalse(host.isPlaying());
        assertEquals("Already stopped (not in play mode).", run(Map.of("action", "stop")).get("message"));
    }

    @Test
    void reportsState() {
        host.setPlaying(true);
        var result = run(Map.of("action", "get_state"));

        assertEquals(true, result.get("success"));
        assertEquals(Map.of("playing", true, "paused", false, "activeTool", "Move"), result.get("data"));
    }

    @Test
    void setsActiveTool() {
        assertEquals("Set active tool to 'Rotate'.", run(Map.of("action", "set_active_tool", "toolName", "rotate")).get("message"));
        assertEquals("Rotate", host.activeTool());

        var invalid = run(Map.of("action", "set_active_tool", "toolName", "Lasso"));
        assertEquals(false, invalid.get("success"));
        assertTrue(((String) invalid.get("error")).startsWith("Could not parse 'Lasso'"));
        assertEquals("'toolName' parameter required for set_active_tool.", run(Map.of("action", "set_active_tool")).get("error"));
    }

    @Test
    void managesTags() {
        assertEquals("Tag 'Enemy' added successfully.", run(Map.of("action", "add_tag", "tagName", "Enemy")).get("message"));
        assertEquals("Tag 'Enemy' already exists.", run(Map.of("action", "add_tag", "tagName", "Enemy")).get("error"));
        assertTrue(host.tags().contains("Enemy"));

        assertEquals("Cannot remove built-in tag 'Player'.", run(Map.of("action", "remove_tag", "tagName", "Player")).get("error"));
        assertEquals("Tag 'Enemy' removed successfully.", run(Map.of("action", "remove_tag", "tagName", "Enemy")).get("message"));
        assertEquals("Tag 'Enemy' does not exist.", run(Map.of("action", "remove_tag", "tagName", "Enemy")).get("error"));
        assertEquals("'tagName' parameter required for add_tag.", run(Map.of("action", "add_tag")).get("error"));
    }

    @Test
    void managesLayersInUserSlots() {
        var added = run(Map.of("action", "add_layer", "layerName", "Enemies"));
        assertEquals("Layer 'Enemies' added to slot 8.", added.get("message"));
        assertEquals(Map.of("layerName", "Enemies", "index", 8), added.get("data"));
        assertEquals("Layer 'Enemies' already exists at index 8.", run(Map.of("action", "add_layer", "layerName", "Enemies")).get("error"));
        assertEquals("Layer 'Water' already exists at index 4.", run(Map.of("action", "add_layer", "layerName", "Water")).get("error"));

        assertEquals("User layer 'Water' not found.", run(Map.of("action", "remove_layer", "layerName", "Water")).get("error"));
        assertEquals("Layer 'Enemies' (slot 8) removed successfully.", run(Map.of("action", "remove_layer", "layerName", "Enemies")).get("message"));
        assertEquals(null, host.layers().get(8));
    }

    @Test
    void reportsFullLayerTable() {
        for (int i = EditorHost.FIRST_USER_LAYER; i < EditorHost.LAYER_COUNT; i++) {
            assertEquals(true, run(Map.of("action", "add_layer", "layerName", "L" + i)).get("success"));
        }
        assertEquals(
            "No empty User Layer slots available (8-31 are all filled).",
            run(Map.of("action", "add_layer", "layerName", "Overflow")).get("error")
        );
    }

    @Test
    void rejectsUnknownAction() {
        var result = run(Map.of("action", "explode"));
        assertTrue(((String) result.get("error")).startsWith("Unknown action: 'explode'. Supported actions: play,"));
    }
}
