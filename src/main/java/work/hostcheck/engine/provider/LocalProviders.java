package work.hostcheck.engine.provider;

import work.hostcheck.engine.backend.LocalBackend;
import work.hostcheck.engine.resource.ProviderDirectory;

/**
 * Provider directory shared by the CLI, the runner and tests.
 */
public final class LocalProviders {
    private LocalProviders() {}

    public static ProviderDirectory directory() {
        return register(ProviderDirectory.builder()).build();
    }

    public static ProviderDirectory.Builder register(ProviderDirectory.Builder builder) {
        return builder
            .register(CommandResource.class)
            .register(FileResource.class, backend -> backend instanceof LocalBackend)
            .register(PackageResource.class, PackageResource::supported)
            .register(ServiceResource.class, ServiceResource::supported)
            .register(SystemInfoResource.class);
    }
}
