package work.hostbridge.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.hostbridge.shared.DurationParser;

/**
 * Reads {@link BridgeConfiguration} from TOML:
 *
 * <pre>
 * log_level = "debug"
 *
 * [scheduler]
 * tick_interval = "16ms"
 *
 * [commands]
 * timeout = "45s"
 * </pre>
 *
 * Missing keys keep the builder defaults.
 */
public final class BridgeConfigurationLoader {
    private BridgeConfigurationLoader() {}

    public static BridgeConfiguration load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Configuration file not found: " + file);
        }
        return parse(Files.readString(file), file.toString());
    }

    public static BridgeConfiguration parse(String toml, String source) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid configuration " + source + ": " + result.errors().get(0));
        }
        var builder = BridgeConfiguration.builder();
        logLevel(result).ifPresent(builder::logLevel);
        duration(result, "scheduler", "tick_interval").ifPresent(builder::tickInterval);
        duration(result, "commands", "timeout").ifPresent(builder::commandTimeout);
        try {
            return builder.build();
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid configuration " + source + ": " + ex.getMessage(), ex);
        }
    }

    private static Optional<LogLevel> logLevel(TomlParseResult root) {
        Optional<String> raw = stringValue(root, "log_level");
        try {
            return raw.map(LogLevel::from);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("log_level: " + ex.getMessage(), ex);
        }
    }

    private static Optional<Duration> duration(TomlParseResult root, String table, String key) {
        TomlTable section = root.getTable(table);
        if (section == null || !section.contains(key)) {
            return Optional.empty();
        }
        Object value = section.get(key);
        if (value instanceof Long millis) {
            return Optional.of(Duration.ofMillis(millis));
        }
        try {
            return DurationParser.parse(String.valueOf(value));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(table + "." + key + ": " + ex.getMessage(), ex);
        }
    }

    private static Optional<String> stringValue(TomlTable table, String key) {
        if (!table.contains(key)) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(table.get(key)));
    }
}
