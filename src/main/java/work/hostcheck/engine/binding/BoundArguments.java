package work.hostcheck.engine.binding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declared checks split into constructor arguments and the checks left to verify, both in declaration order.
 */
public record BoundArguments(
    boolean passSubject,
    Map<String, Object> constructorArguments,
    Map<String, Object> remainingChecks
) {
    public BoundArguments {
        constructorArguments = Collections.unmodifiableMap(new LinkedHashMap<>(constructorArguments));
        remainingChecks = Collections.unmodifiableMap(new LinkedHashMap<>(remainingChecks));
    }
}
