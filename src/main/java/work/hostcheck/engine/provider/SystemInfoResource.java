package work.hostcheck.engine.provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.hostcheck.engine.backend.Backend;
import work.hostcheck.engine.backend.CommandResult;
import work.hostcheck.engine.resource.Attribute;
import work.hostcheck.engine.resource.ResourceType;

/**
 * Operating system and distribution of the target. Takes no subject.
 */
@ResourceType(value = "SystemInfo", description = "Return system information")
public final class SystemInfoResource {
    private final Backend backend;
    private Map<String, String> osRelease;

    public SystemInfoResource(Backend backend) {
        this.backend = backend;
    }

    @Attribute
    public String type() {
        return uname("-s").toLowerCase(Locale.ROOT);
    }

    @Attribute
    public String arch() {
        return uname("-m");
    }

    @Attribute
    public String hostname() {
        return uname("-n");
    }

    @Attribute
    public String distribution() {
        return osRelease().get("ID");
    }

    @Attribute
    public String release() {
        return osRelease().get("VERSION_ID");
    }

    @Attribute
    public String codename() {
        return osRelease().get("VERSION_CODENAME");
    }

    private String uname(String flag) {
        CommandResult result = backend.run(List.of("uname", flag));
        if (!result.succeeded()) {
            throw new IllegalStateException("uname " + flag + " failed: " + result.stderr().trim());
        }
        return result.stdout().trim();
    }

    private Map<String, String> osRelease() {
        if (osRelease == null) {
            CommandResult result = backend.run(List.of("cat", "/etc/os-release"));
            osRelease = result.succeeded() ? parseOsRelease(result.stdout()) : Map.of();
        }
        return osRelease;
    }

    static Map<String, String> parseOsRelease(String content) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String line : content.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String value = trimmed.substring(eq + 1).trim();
            if (value.length() >= 2 && (value.startsWith("\"") && value.endsWith("\"") || value.startsWith("'") && value.endsWith("'"))) {
                value = value.substring(1, value.length() - 1);
            }
            values.put(trimmed.substring(0, eq), value);
        }
        return values;
    }
}
