package work.hostbridge.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name to handler table. Built once by {@link #initialize()} from the configured units and read-only afterwards.
 */
public final class CommandRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(CommandRegistry.class);

    private final List<CommandUnit> units;
    private final Object initLock = new Object();
    private volatile Map<String, Entry> handlers = Map.of();
    private volatile List<String> diagnostics = List.of();
    private volatile boolean initialized;

    public CommandRegistry(List<? extends CommandUnit> units) {
        Objects.requireNonNull(units, "units");
        this.units = List.copyOf(units);
    }

    /**
     * Registers every unit. Units later in the list override earlier ones that derive the same name.
     * Subsequent calls are no-ops.
     */
    public void initialize() {
        if (initialized) {
            return;
        }
        synchronized (initLock) {
            if (initialized) {
                return;
            }
            var table = new LinkedHashMap<String, Entry>();
            var warnings = new ArrayList<String>();
            for (CommandUnit unit : units) {
                register(unit, table, warnings);
            }
            handlers = Collections.unmodifiableMap(table);
            diagnostics = List.copyOf(warnings);
            initialized = true;
            LOG.info("Discovered {} commands", table.size());
        }
    }

    private static void register(CommandUnit unit, Map<String, Entry> table, List<String> warnings) {
        String unitName = unit.getClass().getSimpleName().isEmpty() ? unit.toString() : unit.getClass().getSimpleName();
        String name;
        CommandHandler handler;
        try {
            name = CommandNames.derive(unit);
            handler = unit.handler();
        } catch (RuntimeException ex) {
            warn(warnings, "Failed to register command unit " + unitName + ": " + ex.getMessage());
            return;
        }
        if (name == null || name.isEmpty()) {
            warn(warnings, "Command unit " + unitName + " has no name and none can be derived; skipping");
            return;
        }
        if (handler == null) {
            warn(warnings, "Command unit " + unitName + " provides no handler; skipping '" + name + "'");
            return;
        }
        if (table.containsKey(name)) {
            warn(warnings, "Duplicate command name '" + name + "' detected. "
                + unitName + " overrides " + table.get(name).unit());
        }
        table.put(name, new Entry(name, unitName, handler));
    }

    private static void warn(List<String> warnings, String message) {
        LOG.warn(message);
        warnings.add(message);
    }

    /**
     * @throws UnknownCommandException when nothing is registered under {@code name}
     */
    public CommandHandler resolve(String name) {
        Entry entry = name == null ? null : handlers.get(name);
        if (entry == null) {
            throw new UnknownCommandException(name);
        }
        return entry.handler();
    }

    public boolean isInitialized() {
        return initialized;
    }

    public Map<String, Entry> entries() {
        return handlers;
    }

    /**
     * Warnings raised while registering units (duplicates, units without handlers).
     */
    public List<String> diagnostics() {
        return diagnostics;
    }

    public record Entry(String name, String unit, CommandHandler handler) {}
}
