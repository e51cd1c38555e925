package work.hostbridge.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings for a {@link HostBridge}.
 *
 * @param tickInterval delay between loop turns while commands are pending (dedicated loop thread only)
 * @param commandTimeout how long {@link HostBridge#execute(String)} waits for a response
 * @param logLevel root log threshold applied by the CLI
 */
public record BridgeConfiguration(Duration tickInterval, Duration commandTimeout, LogLevel logLevel) {
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofMillis(10);
    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(30);

    public BridgeConfiguration {
        Objects.requireNonNull(tickInterval, "tickInterval");
        Objects.requireNonNull(commandTimeout, "commandTimeout");
        Objects.requireNonNull(logLevel, "logLevel");
        if (tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must not be negative");
        }
        if (commandTimeout.isNegative() || commandTimeout.isZero()) {
            throw new IllegalArgumentException("commandTimeout must be positive");
        }
    }

    public static BridgeConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .tickInterval(tickInterval)
            .commandTimeout(commandTimeout)
            .logLevel(logLevel);
    }

    public static final class Builder {
        private Duration tickInterval = DEFAULT_TICK_INTERVAL;
        private Duration commandTimeout = DEFAULT_COMMAND_TIMEOUT;
        private LogLevel logLevel = LogLevel.INFO;

        public Builder tickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
            return this;
        }

        public Builder commandTimeout(Duration commandTimeout) {
            this.commandTimeout = commandTimeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public BridgeConfiguration build() {
            return new BridgeConfiguration(tickInterval, commandTimeout, logLevel);
        }
    }
}
