package work.hostbridge.commands;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory editor the built-in commands operate on. Mutating methods are meant to be called from the host loop
 * thread only; menu items and tests are registered during setup.
 */
public final class EditorHost {
    public static final List<String> BUILT_IN_TAGS = List.of(
        "Untagged", "Respawn", "Finish", "EditorOnly", "MainCamera", "Player", "GameController"
    );
    public static final List<String> TOOLS = List.of("View", "Move", "Rotate", "Scale", "Rect", "Transform");
    static final int FIRST_USER_LAYER = 8;
    static final int LAYER_COUNT = 32;

    private boolean playing;
    private boolean paused;
    private String activeTool = "Move";
    private final List<String> tags = new ArrayList<>(BUILT_IN_TAGS);
    private final String[] layers = new String[LAYER_COUNT];
    private final Map<String, Runnable> menuItems = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, TestCase> tests = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<ConsoleEntry> console = new CopyOnWriteArrayList<>();

    public EditorHost() {
        layers[0] = "Default";
        layers[1] = "TransparentFX";
        layers[2] = "Ignore Raycast";
        layers[4] = "Water";
        layers[5] = "UI";
    }

    public boolean isPlaying() {
        return playing;
    }

    public void setPlaying(boolean playing) {
        this.playing = playing;
        if (!playing) {
            paused = false;
        }
    }

    public boolean isPaused() {
        return paused;
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
    }

    public String activeTool() {
        return activeTool;
    }

    /**
     * @return the canonical tool name, or {@code null} when {@code name} is not a known tool
     */
    public String selectTool(String name) {
        for (String tool : TOOLS) {
            if (tool.equalsIgnoreCase(name)) {
                activeTool = tool;
                return tool;
            }
        }
        return null;
    }

    public List<String> tags() {
        return List.copyOf(tags);
    }

    boolean addTag(String tag) {
        if (tags.contains(tag)) {
            return false;
        }
        return tags.add(tag);
    }

    boolean removeTag(String tag) {
        return tags.remove(tag);
    }

    public List<String> layers() {
        return Collections.unmodifiableList(Arrays.asList(layers.clone()));
    }

    int indexOfLayer(String name) {
        for (int i = 0; i < LAYER_COUNT; i++) {
            if (name.equals(layers[i])) {
                return i;
            }
        }
        return -1;
    }

    String layerAt(int index) {
        return layers[index];
    }

    void setLayer(int index, String name) {
        layers[index] = name;
    }

    public void registerMenuItem(String path, Runnable action) {
        menuItems.put(Objects.requireNonNull(path, "path"), Objects.requireNonNull(action, "action"));
    }

    Runnable menuItem(String path) {
        return menuItems.get(path);
    }

    public void registerTest(String name, TestMode mode, TestBody body) {
        Objects.requireNonNull(name, "name");
        tests.put(name, new TestCase(name, Objects.requireNonNull(mode, "mode"), Objects.requireNonNull(body, "body")));
    }

    List<TestCase> tests(TestMode mode) {
        synchronized (tests) {
            return tests.values().stream().filter(test -> test.mode() == mode).toList();
        }
    }

    public void log(LogType type, String message) {
        console.add(new ConsoleEntry(type, message, Instant.now()));
    }

    public List<ConsoleEntry> console() {
        return List.copyOf(console);
    }

    void clearConsole() {
        console.clear();
    }

    public enum LogType {
        LOG,
        WARNING,
        ERROR;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum TestMode {
        EDIT_MODE("EditMode"),
        PLAY_MODE("PlayMode");

        private final String label;

        TestMode(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        public static TestMode parse(String value) {
            String candidate = value == null || value.isBlank() ? EDIT_MODE.label : value.trim();
            for (TestMode mode : values()) {
                if (mode.label.equalsIgnoreCase(candidate)) {
                    return mode;
                }
            }
            throw new IllegalArgumentException(
                "Unknown test mode: '" + value + "'. Use 'EditMode' or 'PlayMode'."
            );
        }
    }

    /**
     * Test body; passes unless it throws.
     */
    @FunctionalInterface
    public interface TestBody {
        void run() throws Exception;
    }

    public record ConsoleEntry(LogType type, String message, Instant timestamp) {}

    record TestCase(String name, TestMode mode, TestBody body) {}
}
