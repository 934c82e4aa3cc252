package work.hostcheck.engine.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.hostcheck.engine.backend.Backend;

/**
 * Immutable configuration for one {@link HostcheckRunner} execution.
 */
public record HostcheckConfiguration(
    List<Path> documents,
    String backendSelector,
    Optional<Duration> commandTimeout,
    LogLevel logLevel,
    OutputFormat outputFormat
) {
    public HostcheckConfiguration {
        Objects.requireNonNull(documents, "documents");
        Objects.requireNonNull(backendSelector, "backendSelector");
        Objects.requireNonNull(commandTimeout, "commandTimeout");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(outputFormat, "outputFormat");
        documents = List.copyOf(documents);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Path> documents = new ArrayList<>();
        private String backendSelector = Backend.DEFAULT_SELECTOR;
        private Optional<Duration> commandTimeout = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;
        private OutputFormat outputFormat = OutputFormat.JSON;

        public Builder document(Path document) {
            this.documents.add(document);
            return this;
        }

        public Builder documents(List<Path> documents) {
            this.documents.addAll(documents);
            return this;
        }

        public Builder backendSelector(String backendSelector) {
            this.backendSelector = backendSelector;
            return this;
        }

        public Builder commandTimeout(Optional<Duration> commandTimeout) {
            this.commandTimeout = commandTimeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder outputFormat(OutputFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public HostcheckConfiguration build() {
            return new HostcheckConfiguration(documents, backendSelector, commandTimeout, logLevel, outputFormat);
        }
    }
}
