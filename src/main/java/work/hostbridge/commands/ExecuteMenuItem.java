package work.hostbridge.commands;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.hostbridge.registry.CommandHandler;
import work.hostbridge.registry.CommandUnit;
import work.hostbridge.registry.HandlerResult;

/**
 * Runs a registered editor menu item by path. Registered under the derived name {@code execute_menu_item}.
 */
public final class ExecuteMenuItem implements CommandUnit {
    private static final Logger LOG = LoggerFactory.getLogger(ExecuteMenuItem.class);
    private static final Set<String> BLOCKED = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

    static {
        BLOCKED.add("File/Quit");
    }

    private final EditorHost host;

    public ExecuteMenuItem(EditorHost host) {
        this.host = Objects.requireNonNull(host, "host");
    }

    @Override
    public CommandHandler handler() {
        return params -> HandlerResult.immediate(handle(params));
    }

    Map<String, Object> handle(Map<String, Object> params) {
        String menuPath = Params.string(params, "menu_path", "menuPath");
        if (menuPath == null) {
            return HandlerResponses.error("Required parameter 'menu_path' or 'menuPath' is missing or empty.");
        }
        if (BLOCKED.contains(menuPath)) {
            return HandlerResponses.error("Execution of menu item '" + menuPath + "' is blocked for safety reasons.");
        }
        Runnable action = host.menuItem(menuPath);
        if (action == null) {
            return HandlerResponses.error("Failed to execute menu item '" + menuPath + "'. It might be invalid, disabled, or context-dependent.");
        }
        try {
            action.run();
        } catch (RuntimeException ex) {
            LOG.error("Menu item '{}' failed: {}", menuPath, ex.getMessage(), ex);
            return HandlerResponses.error("Error executing menu item '" + menuPath + "': " + ex.getMessage());
        }
        return HandlerResponses.success("Executed menu item: '" + menuPath + "'.");
    }
}
