package work.hostcheck.engine.resource;

import java.util.List;

/**
 * Introspected constructor shape of a resource handle. {@code parameterNames} never contains the subject.
 */
public record ConstructorSignature(boolean acceptsSubject, List<String> parameterNames) {
    public ConstructorSignature {
        parameterNames = parameterNames == null ? List.of() : List.copyOf(parameterNames);
    }

    public static ConstructorSignature subjectOnly() {
        return new ConstructorSignature(true, List.of());
    }

    public static ConstructorSignature parameterless() {
        return new ConstructorSignature(false, List.of());
    }
}
