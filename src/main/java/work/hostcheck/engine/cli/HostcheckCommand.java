package work.hostcheck.engine.cli;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.hostcheck.engine.api.HostcheckConfiguration;
import work.hostcheck.engine.api.HostcheckRunner;
import work.hostcheck.engine.api.LogLevel;
import work.hostcheck.engine.api.OutputFormat;
import work.hostcheck.engine.api.SuiteResult;
import work.hostcheck.engine.backend.Backend;
import work.hostcheck.engine.backend.Backends;
import work.hostcheck.engine.config.HostcheckSettings;
import work.hostcheck.engine.config.SettingsLoader;
import work.hostcheck.engine.provider.LocalProviders;
import work.hostcheck.engine.registry.VerifierRegistry;
import work.hostcheck.engine.resource.ResourceResolver;
import work.hostcheck.engine.shared.DurationParser;

@CommandLine.Command(
    name = "hostcheck",
    description = "Verify declared host state (packages, services, files, commands).",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class HostcheckCommand implements Callable<Integer> {
    @CommandLine.Parameters(
        paramLabel = "DOCUMENT",
        arity = "0..*",
        description = "YAML declaration documents."
    )
    private List<Path> documents = new ArrayList<>();

    @CommandLine.Option(
        names = {"-b", "--backend"},
        description = "Backend selector (default: local://).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String backend;

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "TOML configuration file (default: ./hostcheck.toml when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--timeout",
        description = "Per-command timeout on the backend (e.g. 500ms, 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Output format (json|text).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String formatRaw;

    @CommandLine.Option(
        names = "--list-resources",
        description = "List the registered resource types and exit."
    )
    private boolean listResources;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        HostcheckSettings settings = SettingsLoader.load(config != null ? config : Path.of(SettingsLoader.DEFAULT_FILE_NAME));
        LogLevel logLevel = logLevelRaw != null ? LogLevel.from(logLevelRaw) : settings.logLevel().orElse(LogLevel.WARN);
        LoggingSetup.apply(logLevel);

        String selector = backend != null ? backend : settings.backendSelector().orElse(Backend.DEFAULT_SELECTOR);
        Optional<Duration> timeout = timeoutRaw != null ? DurationParser.parse(timeoutRaw) : settings.commandTimeout();
        OutputFormat format = formatRaw != null ? OutputFormat.from(formatRaw) : settings.outputFormat().orElse(OutputFormat.JSON);

        if (listResources) {
            printResources(selector, timeout);
            return 0;
        }
        if (documents == null || documents.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "At least one DOCUMENT is required.");
        }

        HostcheckConfiguration configuration = HostcheckConfiguration.builder()
            .documents(documents)
            .backendSelector(selector)
            .commandTimeout(timeout)
            .logLevel(logLevel)
            .outputFormat(format)
            .build();

        SuiteResult result = new HostcheckRunner().run(configuration);
        var out = spec.commandLine().getOut();
        out.println(format == OutputFormat.TEXT ? result.toText() : result.toPrettyJson());
        out.flush();
        return result.status().exitCode();
    }

    private void printResources(String selector, Optional<Duration> timeout) {
        var resolver = new ResourceResolver(LocalProviders.directory(), Backends.factory(timeout));
        var registry = VerifierRegistry.create(resolver, selector);
        var out = spec.commandLine().getOut();
        registry.entries().values().forEach(entry ->
            out.printf("%-14s %s%n", entry.name(), entry.description())
        );
        out.flush();
    }
}
