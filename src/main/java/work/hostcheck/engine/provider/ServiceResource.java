package work.hostcheck.engine.provider;

import java.util.List;
import work.hostcheck.engine.backend.Backend;
import work.hostcheck.engine.backend.CommandResult;
import work.hostcheck.engine.resource.Attribute;
import work.hostcheck.engine.resource.ResourceType;
import work.hostcheck.engine.resource.Subject;

/**
 * systemd services.
 */
@ResourceType(value = "Service", description = "Test services")
public final class ServiceResource {
    private static final String SYSTEMCTL = "systemctl";

    private final Backend backend;

    @Attribute
    private final String name;

    public ServiceResource(Backend backend, @Subject String name) {
        this.backend = backend;
        this.name = name;
    }

    static boolean supported(Backend backend) {
        return backend.hasCommand(SYSTEMCTL);
    }

    @Attribute
    public boolean isRunning() {
        return systemctl("is-active").succeeded();
    }

    @Attribute
    public boolean isEnabled() {
        CommandResult result = systemctl("is-enabled");
        return result.succeeded() && !"static".equals(result.stdout().trim());
    }

    @Attribute
    public boolean isMasked() {
        return "masked".equals(systemctl("is-enabled").stdout().trim());
    }

    @Attribute
    public boolean exists() {
        CommandResult result = backend.run(List.of(SYSTEMCTL, "list-unit-files", "--no-legend", unit()));
        return result.succeeded() && !result.stdout().isBlank();
    }

    private CommandResult systemctl(String verb) {
        return backend.run(List.of(SYSTEMCTL, verb, unit()));
    }

    private String unit() {
        return name.contains(".") ? name : name + ".service";
    }
}
