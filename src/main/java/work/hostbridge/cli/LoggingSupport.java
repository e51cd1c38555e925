package work.hostbridge.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.hostbridge.api.LogLevel;

final class LoggingSupport {
    private LoggingSupport() {}

    /**
     * Applies {@code level} to the root logger when Logback is the active SLF4J binding.
     */
    static void apply(LogLevel level) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.toLevel(level.name(), Level.INFO));
        }
    }
}
