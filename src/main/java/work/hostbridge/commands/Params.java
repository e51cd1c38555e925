package work.hostbridge.commands;

import java.util.List;
import java.util.Map;

final class Params {
    private Params() {}

    /**
     * First non-blank string value among {@code keys}, or {@code null}.
     */
    static String string(Map<String, Object> params, String... keys) {
        for (String key : keys) {
            Object value = params.get(key);
            if (value != null) {
                String text = String.valueOf(value);
                if (!text.isBlank()) {
                    return text.trim();
                }
            }
        }
        return null;
    }

    static Integer integer(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Integer.parseInt(str.trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    static List<String> strings(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value instanceof List<?> list) {
            return list.stream().filter(item -> item != null).map(String::valueOf).toList();
        }
        if (value instanceof String str && !str.isBlank()) {
            return List.of(str.split(","))
                .stream()
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .toList();
        }
        return List.of();
    }
}
