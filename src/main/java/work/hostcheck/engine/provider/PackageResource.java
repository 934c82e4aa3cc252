package work.hostcheck.engine.provider;

import java.util.List;
import work.hostcheck.engine.backend.Backend;
import work.hostcheck.engine.backend.CommandResult;
import work.hostcheck.engine.resource.Attribute;
import work.hostcheck.engine.resource.ResourceType;
import work.hostcheck.engine.resource.Subject;

/**
 * Installed system packages, queried through dpkg or rpm.
 */
@ResourceType(value = "Package", description = "Test packages status and version")
public final class PackageResource {
    private static final String DPKG = "dpkg-query";
    private static final String RPM = "rpm";

    private final Backend backend;
    private final boolean debian;

    @Attribute
    private final String name;

    public PackageResource(Backend backend, @Subject String name) {
        this.backend = backend;
        this.name = name;
        this.debian = backend.hasCommand(DPKG);
    }

    static boolean supported(Backend backend) {
        return backend.hasCommand(DPKG) || backend.hasCommand(RPM);
    }

    @Attribute
    public boolean isInstalled() {
        if (debian) {
            CommandResult result = dpkgQuery("${Status}");
            return result.succeeded() && isInstalledStatus(result.stdout());
        }
        return backend.run(List.of(RPM, "-q", name)).succeeded();
    }

    @Attribute
    public String version() {
        if (debian) {
            CommandResult result = dpkgQuery("${Status} ${Version}");
            if (!result.succeeded() || !isInstalledStatus(result.stdout())) {
                throw notInstalled();
            }
            String[] parts = result.stdout().trim().split(" ");
            return parts[parts.length - 1];
        }
        return rpmQuery("%{VERSION}");
    }

    @Attribute
    public String release() {
        if (debian) {
            throw new UnsupportedOperationException("release is not available for dpkg packages");
        }
        return rpmQuery("%{RELEASE}");
    }

    private CommandResult dpkgQuery(String format) {
        return backend.run(List.of(DPKG, "-f", format, "-W", name));
    }

    private String rpmQuery(String format) {
        CommandResult result = backend.run(List.of(RPM, "-q", "--queryformat", format, name));
        if (!result.succeeded()) {
            throw notInstalled();
        }
        return result.stdout().trim();
    }

    private IllegalStateException notInstalled() {
        return new IllegalStateException("The package " + name + " is not installed");
    }

    // "install ok installed" or "hold ok installed"
    private static boolean isInstalledStatus(String status) {
        String[] words = status.trim().split("\\s+");
        return words.length >= 3 && "ok".equals(words[1]) && "installed".equals(words[2]);
    }
}
