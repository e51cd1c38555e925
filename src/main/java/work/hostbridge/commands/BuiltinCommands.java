package work.hostbridge.commands;

import java.util.List;
import work.hostbridge.host.HostLoop;
import work.hostbridge.registry.CommandUnit;

/**
 * Registration table for the commands shipped with the bridge, so the CLI, the embedding facade and tests share
 * the same set.
 */
public final class BuiltinCommands {
    private BuiltinCommands() {}

    public static List<CommandUnit> units(EditorHost host, HostLoop loop) {
        return List.of(
            new ManageEditor(host),
            new ExecuteMenuItem(host),
            new ReadConsole(host),
            new RunTests(host, loop)
        );
    }
}
