package work.hostcheck.engine.resource;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.Locale;
import java.util.Objects;

/**
 * Reflective accessor for one member a provider exposes to declared checks.
 */
public final class ResourceMember {
    public enum Kind {
        ATTRIBUTE,
        OPERATION,
        VALUE
    }

    private final String name;
    private final Kind kind;
    private final Method method;
    private final Field field;

    private ResourceMember(String name, Kind kind, Method method, Field field) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.method = method;
        this.field = field;
    }

    static ResourceMember attribute(String name, Method method) {
        return new ResourceMember(name, Kind.ATTRIBUTE, method, null);
    }

    static ResourceMember operation(String name, Method method) {
        return new ResourceMember(name, Kind.OPERATION, method, null);
    }

    static ResourceMember value(String name, Field field) {
        return new ResourceMember(name, Kind.VALUE, null, field);
    }

    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isStatic() {
        return field != null && Modifier.isStatic(field.getModifiers());
    }

    /**
     * Generic type of the single operation parameter.
     */
    public Type parameterType() {
        if (kind != Kind.OPERATION) {
            throw new IllegalStateException(name + " is not an operation");
        }
        return method.getGenericParameterTypes()[0];
    }

    /**
     * Reads a computed attribute or a plain value.
     *
     * @throws InvocationTargetException when the provider's attribute method throws
     */
    public Object read(Object instance) throws IllegalAccessException, InvocationTargetException {
        return switch (kind) {
            case ATTRIBUTE -> method.invoke(instance);
            case VALUE -> field.get(isStatic() ? null : instance);
            case OPERATION -> throw new IllegalStateException(name + " is an operation and needs an argument");
        };
    }

    /**
     * Invokes an operation with an argument already converted to {@link #parameterType()}.
     */
    public Object invoke(Object instance, Object argument) throws IllegalAccessException, InvocationTargetException {
        if (kind != Kind.OPERATION) {
            throw new IllegalStateException(name + " is not an operation");
        }
        return method.invoke(instance, argument);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + " " + name;
    }
}
