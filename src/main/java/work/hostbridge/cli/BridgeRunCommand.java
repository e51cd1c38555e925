package work.hostbridge.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import picocli.CommandLine;
import work.hostbridge.api.BridgeConfiguration;
import work.hostbridge.api.BridgeConfigurationLoader;
import work.hostbridge.api.HostBridge;
import work.hostbridge.api.LogLevel;
import work.hostbridge.commands.EditorHost;
import work.hostbridge.dispatch.CancellationToken;
import work.hostbridge.envelope.ResponseEnvelopes;
import work.hostbridge.shared.DurationParser;

@CommandLine.Command(
    name = "bridge-run",
    description = "Dispatch JSON commands to an in-process editor host and print each response.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class BridgeRunCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--command"},
        description = "Raw command text, e.g. '{\"type\":\"manage_editor\",\"params\":{\"action\":\"play\"}}' or 'ping'.",
        arity = "1..*"
    )
    private List<String> commands = new ArrayList<>();

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|-",
        description = "File with one command per line; use '-' to read from stdin.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String input;

    @CommandLine.Option(
        names = "--config",
        description = "TOML configuration file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--tick-interval",
        description = "Delay between host loop turns while commands are pending (e.g. 10ms).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String tickIntervalRaw;

    @CommandLine.Option(
        names = "--timeout",
        description = "Per-command response timeout (e.g. 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(names = "--list", description = "Print the registered command names and exit.")
    private boolean list;

    @CommandLine.Option(
        names = "--sequential",
        description = "Wait for each response before submitting the next command."
    )
    private boolean sequential;

    @Override
    public Integer call() throws Exception {
        BridgeConfiguration configuration = resolveConfiguration();
        LoggingSupport.apply(configuration.logLevel());
        PrintWriter out = spec.commandLine().getOut();

        try (HostBridge bridge = HostBridge.builder()
            .configuration(configuration)
            .host(sampleHost())
            .build()
            .start()) {
            if (list) {
                bridge.registry().entries().keySet().stream().sorted().forEach(out::println);
                out.flush();
                return 0;
            }

            List<String> texts = collectCommands();
            if (texts.isEmpty()) {
                throw new CommandLine.ParameterException(spec.commandLine(), "No commands given; use --command or --input.");
            }

            List<String> responses = sequential
                ? runSequential(bridge, texts, configuration.commandTimeout())
                : runConcurrent(bridge, texts, configuration.commandTimeout());

            int exitCode = 0;
            for (String response : responses) {
                out.println(response);
                if (!isSuccess(response)) {
                    exitCode = 1;
                }
            }
            out.flush();
            return exitCode;
        }
    }

    private List<String> runSequential(HostBridge bridge, List<String> texts, Duration timeout) throws InterruptedException {
        var responses = new ArrayList<String>(texts.size());
        for (String text : texts) {
            var token = new CancellationToken();
            responses.add(await(bridge.executeAsync(text, token), token, timeout));
        }
        return responses;
    }

    private List<String> runConcurrent(HostBridge bridge, List<String> texts, Duration timeout) throws InterruptedException {
        var tokens = new ArrayList<CancellationToken>(texts.size());
        var futures = new ArrayList<CompletableFuture<String>>(texts.size());
        for (String text : texts) {
            var token = new CancellationToken();
            tokens.add(token);
            futures.add(bridge.executeAsync(text, token));
        }
        var responses = new ArrayList<String>(texts.size());
        for (int i = 0; i < futures.size(); i++) {
            responses.add(await(futures.get(i), tokens.get(i), timeout));
        }
        return responses;
    }

    private String await(CompletableFuture<String> future, CancellationToken token, Duration timeout)
        throws InterruptedException {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            token.cancel();
            return ResponseEnvelopes.error("Timed out after " + timeout.toMillis() + " ms waiting for a response", null);
        } catch (CancellationException ex) {
            return ResponseEnvelopes.error("Command cancelled", null);
        } catch (ExecutionException ex) {
            return ResponseEnvelopes.failure(ex.getCause(), null);
        }
    }

    private BridgeConfiguration resolveConfiguration() throws IOException {
        BridgeConfiguration base = config == null
            ? BridgeConfiguration.defaults()
            : BridgeConfigurationLoader.load(config.toAbsolutePath().normalize());
        var builder = base.toBuilder();
        try {
            DurationParser.parse(tickIntervalRaw).ifPresent(builder::tickInterval);
            DurationParser.parse(timeoutRaw).ifPresent(builder::commandTimeout);
            if (logLevelRaw != null) {
                builder.logLevel(LogLevel.from(logLevelRaw));
            }
            return builder.build();
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private List<String> collectCommands() {
        var texts = new ArrayList<String>(commands);
        if (input == null || input.isBlank()) {
            return texts;
        }
        String content = "-".equals(input) ? readStdin() : readFile(Paths.get(input).toAbsolutePath().normalize());
        content.lines().filter(line -> !line.isBlank()).forEach(texts::add);
        return texts;
    }

    private String readFile(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read input file: " + path);
        }
    }

    private String readStdin() {
        try {
            InputStream stdin = System.in;
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }

    private static boolean isSuccess(String response) {
        try {
            JsonNode node = JSON.readTree(response);
            return ResponseEnvelopes.STATUS_SUCCESS.equals(node.path("status").asText());
        } catch (IOException ex) {
            return false;
        }
    }

    /**
     * Editor with a couple of menu items and tests so the built-in commands have something to act on.
     */
    static EditorHost sampleHost() {
        var host = new EditorHost();
        host.registerMenuItem("Assets/Refresh", () -> host.log(EditorHost.LogType.LOG, "Asset database refreshed"));
        host.registerMenuItem("Edit/Play", () -> host.setPlaying(!host.isPlaying()));
        host.registerTest("EditorHostTests.TagsContainBuiltIns", EditorHost.TestMode.EDIT_MODE, () -> {
            if (!host.tags().contains("Untagged")) {
                throw new IllegalStateException("Untagged tag missing");
            }
        });
        host.registerTest("EditorHostTests.DefaultLayerPresent", EditorHost.TestMode.EDIT_MODE, () -> {
            if (!"Default".equals(host.layers().get(0))) {
                throw new IllegalStateException("Default layer missing");
            }
        });
        return host;
    }
}
