package work.hostcheck.engine.resource;

import java.util.Objects;
import java.util.function.Predicate;
import work.hostcheck.engine.backend.Backend;

/**
 * One provider class registered in the {@link ProviderDirectory}.
 */
public record ProviderDefinition(String typeName, String description, Class<?> type, Predicate<Backend> support) {
    public ProviderDefinition {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(type, "type");
        description = description == null ? "" : description;
        support = support == null ? backend -> true : support;
    }

    public boolean supports(Backend backend) {
        return support.test(backend);
    }
}
