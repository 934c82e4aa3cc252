package work.hostcheck.engine.declaration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One declared resource: the snake_case resource type, its subject and the checks to run, in document order.
 */
public record Declaration(String id, String resourceType, String subject, Map<String, Object> checks) {
    public Declaration {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(resourceType, "resourceType");
        checks = checks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }
}
