package work.hostcheck.engine.resource;

import java.util.Objects;
import work.hostcheck.engine.backend.Backend;
import work.hostcheck.engine.backend.BackendFactory;

/**
 * Resolves a snake_case resource name and a backend selector into a {@link ResourceHandle}.
 * Handles are built fresh on every call.
 */
public final class ResourceResolver {
    private final ProviderDirectory directory;
    private final BackendFactory backends;

    public ResourceResolver(ProviderDirectory directory, BackendFactory backends) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.backends = Objects.requireNonNull(backends, "backends");
    }

    public ProviderDirectory directory() {
        return directory;
    }

    /**
     * @throws UnsupportedResourceException when no provider implements the type for the selected backend
     */
    public ResourceHandle resolve(String typeName, String backendSelector) {
        String selector = backendSelector == null || backendSelector.isBlank()
            ? Backend.DEFAULT_SELECTOR
            : backendSelector;
        Backend backend = backends.create(selector);
        ProviderDefinition definition = directory.findByResourceName(typeName)
            .orElseThrow(() -> new UnsupportedResourceException(typeName, selector, "no provider exposed as " + typeName));
        if (!definition.supports(backend)) {
            throw new UnsupportedResourceException(typeName, selector, "not available on this platform");
        }
        return new ReflectiveResourceHandle(definition, backend);
    }
}
