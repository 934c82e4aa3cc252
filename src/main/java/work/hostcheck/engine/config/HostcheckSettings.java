package work.hostcheck.engine.config;

import java.time.Duration;
import java.util.Optional;
import work.hostcheck.engine.api.LogLevel;
import work.hostcheck.engine.api.OutputFormat;

/**
 * Values read from a {@code hostcheck.toml} file. Absent keys stay empty so CLI options can fill them.
 */
public record HostcheckSettings(
    Optional<String> backendSelector,
    Optional<Duration> commandTimeout,
    Optional<LogLevel> logLevel,
    Optional<OutputFormat> outputFormat
) {
    public static HostcheckSettings empty() {
        return new HostcheckSettings(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }
}
