package work.hostbridge.registry;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives wire command names from unit class names ({@code ManageAsset} -> {@code manage_asset}).
 */
public final class CommandNames {
    private static final Pattern WORD_START = Pattern.compile("(.)([A-Z][a-z]+)");
    private static final Pattern LOWER_UPPER = Pattern.compile("([a-z0-9])([A-Z])");

    private CommandNames() {}

    public static String toSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String s1 = WORD_START.matcher(name).replaceAll("$1_$2");
        String s2 = LOWER_UPPER.matcher(s1).replaceAll("$1_$2");
        return s2.toLowerCase(Locale.ROOT);
    }

    public static String derive(CommandUnit unit) {
        String explicit = unit.commandName();
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        return toSnakeCase(unit.getClass().getSimpleName());
    }
}
