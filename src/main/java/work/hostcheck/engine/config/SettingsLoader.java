package work.hostcheck.engine.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import work.hostcheck.engine.api.LogLevel;
import work.hostcheck.engine.api.OutputFormat;
import work.hostcheck.engine.shared.DurationParser;

/**
 * Reads {@link HostcheckSettings} from a TOML file:
 * <pre>
 * [backend]
 * selector = "local://"
 * command_timeout = "30s"
 *
 * [logging]
 * level = "info"
 *
 * [output]
 * format = "text"
 * </pre>
 */
public final class SettingsLoader {
    public static final String DEFAULT_FILE_NAME = "hostcheck.toml";

    private SettingsLoader() {}

    /**
     * Missing files yield empty settings; unreadable or invalid files are errors.
     */
    public static HostcheckSettings load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return HostcheckSettings.empty();
        }
        try {
            return fromToml(Toml.parse(Files.readString(path)), path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read config: " + path, ex);
        }
    }

    public static HostcheckSettings parse(String toml) {
        return fromToml(Toml.parse(toml), "<inline>");
    }

    private static HostcheckSettings fromToml(TomlParseResult result, String source) {
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid config " + source + ": " + errors);
        }
        try {
            return new HostcheckSettings(
                Optional.ofNullable(result.getString("backend.selector")),
                DurationParser.parse(result.getString("backend.command_timeout")),
                Optional.ofNullable(result.getString("logging.level")).map(LogLevel::from),
                Optional.ofNullable(result.getString("output.format")).map(OutputFormat::from)
            );
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid config " + source + ": " + ex.getMessage(), ex);
        }
    }
}
