package work.hostcheck.engine.binding;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import work.hostcheck.engine.resource.ConstructorSignature;

/**
 * Moves declared checks named after constructor parameters into the constructor arguments.
 * The subject name is never part of this partition.
 */
public final class ArgumentBinder {
    public BoundArguments bind(ConstructorSignature signature, Map<String, Object> declaredChecks) {
        Set<String> parameters = new HashSet<>(signature.parameterNames());
        var constructorArguments = new LinkedHashMap<String, Object>();
        var remaining = new LinkedHashMap<String, Object>();
        if (declaredChecks != null) {
            for (var entry : declaredChecks.entrySet()) {
                if (parameters.contains(entry.getKey())) {
                    constructorArguments.put(entry.getKey(), entry.getValue());
                } else {
                    remaining.put(entry.getKey(), entry.getValue());
                }
            }
        }
        return new BoundArguments(signature.acceptsSubject(), constructorArguments, remaining);
    }
}
