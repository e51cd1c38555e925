package work.hostbridge.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import work.hostbridge.registry.CommandNames;

class ExecuteMenuItemTest {
    @Test
    void nameIsDerivedFromClassName() {
        assertEquals("execute_menu_item", CommandNames.derive(new ExecuteMenuItem(new EditorHost())));
    }

    @Test
    void runsRegisteredMenuItem() {
        var host = new EditorHost();
        var runs = new AtomicInteger();
        host.registerMenuItem("Assets/Refresh", runs::incrementAndGet);

        var result = new ExecuteMenuItem(host).handle(Map.of("menuPath", "Assets/Refresh"));

        assertEquals(true, result.get("success"));
        assertEquals("Executed menu item: 'Assets/Refresh'.", result.get("message"));
        assertEquals(1, runs.get());
    }

    @Test
    void acceptsSnakeCaseParameter() {
        var host = new EditorHost();
        host.registerMenuItem("Edit/Play", () -> host.setPlaying(true));

        new ExecuteMenuItem(host).handle(Map.of("menu_path", "Edit/Play"));

        assertEquals(true, host.isPlaying());
    }

    @Test
    void blocksQuit() {
        var host = new EditorHost();
        var runs = new AtomicInteger();
        host.registerMenuItem("File/Quit", runs::incrementAndGet);

        var result = new ExecuteMenuItem(host).handle(Map.of("menuPath", "file/quit"));

        assertEquals("Execution of menu item 'file/quit' is blocked for safety reasons.", result.get("error"));
        assertEquals(0, runs.get());
    }

    @Test
    void reportsMissingAndUnknownItems() {
        var command = new ExecuteMenuItem(new EditorHost());

        assertEquals(
            "Required parameter 'menu_path' or 'menuPath' is missing or empty.",
            command.handle(Map.of("menuPath", " ")).get("error")
        );
        assertEquals(
            "Failed to execute menu item 'Window/Nope'. It might be invalid, disabled, or context-dependent.",
            command.handle(Map.of("menuPath", "Window/Nope")).get("error")
        );
    }

    @Test
    void reportsFailingMenuItem() {
        var host = new EditorHost();
        host.registerMenuItem("Tools/Break", () -> {
            throw new IllegalStateException("no selection");
        });

        var result = new ExecuteMenuItem(host).handle(Map.of("menuPath", "Tools/Break"));

        assertEquals(false, result.get("success"));
        assertEquals("Error executing menu item 'Tools/Break': no selection", result.get("error"));
    }
}
