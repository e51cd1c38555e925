package work.hostbridge.api;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.hostbridge.commands.BuiltinCommands;
import work.hostbridge.commands.EditorHost;
import work.hostbridge.dispatch.CancellationToken;
import work.hostbridge.dispatch.CommandScheduler;
import work.hostbridge.host.HostLoop;
import work.hostbridge.host.ThreadHostLoop;
import work.hostbridge.registry.CommandRegistry;
import work.hostbridge.registry.CommandUnit;

/**
 * Public entry point for embedding the bridge. Wires the built-in commands, any extra units, the host loop and the
 * scheduler, and exposes the inbound contract used by transports.
 *
 * <p>Extra units are registered after the built-ins, so a unit using a built-in name replaces it.
 */
public final class HostBridge implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(HostBridge.class);

    private final BridgeConfiguration configuration;
    private final EditorHost host;
    private final HostLoop loop;
    private final ThreadHostLoop ownedLoop;
    private final CommandRegistry registry;
    private final CommandScheduler scheduler;

    private HostBridge(Builder builder) {
        this.configuration = builder.configuration;
        this.host = builder.host == null ? new EditorHost() : builder.host;
        if (builder.loop == null) {
            this.ownedLoop = new ThreadHostLoop(configuration.tickInterval());
            this.loop = ownedLoop;
        } else {
            this.ownedLoop = null;
            this.loop = builder.loop;
        }
        var units = new ArrayList<CommandUnit>(BuiltinCommands.units(host, loop));
        units.addAll(builder.units);
        this.registry = new CommandRegistry(units);
        this.scheduler = new CommandScheduler(registry, loop);
    }

    public static Builder builder() {
        return new Builder();
    }

    public HostBridge start() {
        if (ownedLoop != null) {
            ownedLoop.start();
        }
        scheduler.start();
        LOG.info("Host bridge started ({} commands)", registry.entries().size());
        return this;
    }

    public void stop() {
        scheduler.stop();
        if (ownedLoop != null) {
            ownedLoop.close();
        }
        LOG.info("Host bridge stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Inbound contract for transports: the future completes with the JSON response envelope, or is cancelled when
     * {@code token} fires before execution starts.
     */
    public CompletableFuture<String> executeAsync(String commandText, CancellationToken token) {
        return scheduler.submit(commandText, token);
    }

    public String execute(String commandText) throws InterruptedException, ExecutionException, TimeoutException {
        return execute(commandText, configuration.commandTimeout());
    }

    /**
     * Submits and waits up to {@code timeout}. When the timeout wins, the request is cancelled if it has not started
     * yet and {@link TimeoutException} is thrown. Must not be called from the host loop thread.
     */
    public String execute(String commandText, Duration timeout)
        throws InterruptedException, ExecutionException, TimeoutException {
        Objects.requireNonNull(timeout, "timeout");
        if (ownedLoop != null && ownedLoop.isLoopThread()) {
            throw new IllegalStateException("execute() would block the host loop thread; use executeAsync()");
        }
        var token = new CancellationToken();
        CompletableFuture<String> future = scheduler.submit(commandText, token);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            token.cancel();
            LOG.debug("Command timed out after {} ms", timeout.toMillis());
            throw ex;
        }
    }

    public BridgeConfiguration configuration() {
        return configuration;
    }

    public EditorHost host() {
        return host;
    }

    public HostLoop loop() {
        return loop;
    }

    public CommandRegistry registry() {
        return registry;
    }

    public CommandScheduler scheduler() {
        return scheduler;
    }

    public static final class Builder {
        private BridgeConfiguration configuration = BridgeConfiguration.defaults();
        private EditorHost host;
        private HostLoop loop;
        private final List<CommandUnit> units = new ArrayList<>();

        public Builder configuration(BridgeConfiguration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration");
            return this;
        }

        public Builder host(EditorHost host) {
            this.host = host;
            return this;
        }

        /**
         * Uses a loop owned by the caller. Without one the bridge runs its own {@link ThreadHostLoop}.
         */
        public Builder loop(HostLoop loop) {
            this.loop = loop;
            return this;
        }

        public Builder unit(CommandUnit unit) {
            units.add(Objects.requireNonNull(unit, "unit"));
            return this;
        }

        public HostBridge build() {
            return new HostBridge(this);
        }
    }
}
