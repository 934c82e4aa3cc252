package work.hostcheck.engine.resource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import work.hostcheck.engine.backend.Backend;
import work.hostcheck.engine.shared.CaseConverter;

/**
 * Write-once table of resource providers keyed by UpperCamelCase type name. Built through {@link Builder}
 * at startup and read-only afterwards.
 */
public final class ProviderDirectory {
    private final Map<String, ProviderDefinition> providers;
    private final Map<String, ProviderDefinition> byResourceName;

    private ProviderDirectory(Map<String, ProviderDefinition> providers) {
        this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        var resourceNames = new LinkedHashMap<String, ProviderDefinition>();
        providers.values().forEach(definition -> resourceNames.put(resourceName(definition.typeName()), definition));
        this.byResourceName = Collections.unmodifiableMap(resourceNames);
    }

    /**
     * snake_case name a provider is exposed under, e.g. {@code HTTPServer} -> {@code http_server}.
     */
    public static String resourceName(String typeName) {
        return CaseConverter.camelToSnake(typeName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> listResourceTypes() {
        return List.copyOf(providers.keySet());
    }

    public Optional<ProviderDefinition> find(String typeName) {
        return Optional.ofNullable(typeName == null ? null : providers.get(typeName));
    }

    public Optional<ProviderDefinition> findByResourceName(String resourceName) {
        return Optional.ofNullable(resourceName == null ? null : byResourceName.get(resourceName));
    }

    public boolean isSupported(String typeName, Backend backend) {
        return find(typeName).map(definition -> definition.supports(backend)).orElse(false);
    }

    public static final class Builder {
        private final Map<String, ProviderDefinition> providers = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(Class<?> type) {
            return register(type, null);
        }

        public Builder register(Class<?> type, Predicate<Backend> support) {
            ResourceType annotation = type.getAnnotation(ResourceType.class);
            if (annotation == null) {
                throw new IllegalArgumentException(type.getName() + " is not annotated with @ResourceType");
            }
            String typeName = annotation.value();
            if (typeName.isBlank()) {
                throw new IllegalArgumentException(type.getName() + " declares a blank resource type name");
            }
            if (providers.containsKey(typeName)) {
                throw new IllegalArgumentException("Duplicate resource type: " + typeName);
            }
            for (String existing : providers.keySet()) {
                if (resourceName(existing).equals(resourceName(typeName))) {
                    throw new IllegalArgumentException(
                        "Resource types " + existing + " and " + typeName + " share the name " + resourceName(typeName)
                    );
                }
            }
            providers.put(typeName, new ProviderDefinition(typeName, annotation.description(), type, support));
            return this;
        }

        public ProviderDirectory build() {
            return new ProviderDirectory(providers);
        }
    }
}
