package work.hostcheck.engine.resource;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.hostcheck.engine.backend.Backend;
import work.hostcheck.engine.shared.ValueConverter;

/**
 * Resource handle backed by an annotated provider class.
 * <p>
 * The provider must declare exactly one constructor. Its parameters, in any order, are an optional
 * {@link Backend}, an optional {@link Subject} string and any number of {@link Param} arguments.
 */
public final class ReflectiveResourceHandle implements ResourceHandle {
    private final ProviderDefinition definition;
    private final Backend backend;
    private final Constructor<?> constructor;
    private final ConstructorSignature signature;
    private final MemberTable members;

    public ReflectiveResourceHandle(ProviderDefinition definition, Backend backend) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.constructor = singleConstructor(definition.type());
        this.signature = inspect(definition.typeName(), constructor);
        this.members = MemberTable.of(definition.type());
    }

    @Override
    public String typeName() {
        return definition.typeName();
    }

    @Override
    public String description() {
        return definition.description();
    }

    @Override
    public Backend backend() {
        return backend;
    }

    @Override
    public ConstructorSignature signature() {
        return signature;
    }

    @Override
    public Object instantiate(String subject, Map<String, Object> arguments) {
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        Parameter[] parameters = constructor.getParameters();
        Object[] values = new Object[parameters.length];
        for (int i = 0; i < parameters.length; i++) {
            Parameter parameter = parameters[i];
            if (parameter.getType() == Backend.class) {
                values[i] = backend;
            } else if (parameter.isAnnotationPresent(Subject.class)) {
                if (subject == null || subject.isBlank()) {
                    throw new ResourceConstructionException(typeName(), "The " + typeName() + " resource requires a subject name");
                }
                values[i] = subject;
            } else {
                String name = parameter.getAnnotation(Param.class).value();
                values[i] = convertArgument(name, args.get(name), parameter);
            }
        }
        try {
            return constructor.newInstance(values);
        } catch (InvocationTargetException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            throw new ResourceConstructionException(
                typeName(),
                "The " + typeName() + " resource failed to instantiate: " + cause.getMessage(),
                cause
            );
        } catch (InstantiationException | IllegalAccessException | IllegalArgumentException ex) {
            throw new ResourceConstructionException(
                typeName(),
                "The " + typeName() + " resource failed to instantiate: " + ex.getMessage(),
                ex
            );
        }
    }

    @Override
    public Optional<ResourceMember> typeMember(String name) {
        return Optional.ofNullable(members.typeMembers().get(name));
    }

    @Override
    public Optional<ResourceMember> instanceMember(Object instance, String name) {
        if (instance == null || !definition.type().isInstance(instance)) {
            return Optional.empty();
        }
        return Optional.ofNullable(members.instanceMembers().get(name));
    }

    @Override
    public String toString() {
        return typeName() + "@" + backend.selector();
    }

    private Object convertArgument(String name, Object value, Parameter parameter) {
        try {
            return ValueConverter.convert(value, parameter.getParameterizedType());
        } catch (IllegalArgumentException ex) {
            throw new ResourceConstructionException(
                typeName(),
                "Argument " + name + " of the " + typeName() + " resource cannot be converted to "
                    + parameter.getType().getSimpleName() + ": " + ex.getMessage(),
                ex
            );
        }
    }

    private static Constructor<?> singleConstructor(Class<?> type) {
        Constructor<?>[] constructors = type.getDeclaredConstructors();
        if (constructors.length != 1) {
            throw new IllegalStateException(type.getName() + " must declare exactly one constructor");
        }
        Constructor<?> constructor = constructors[0];
        constructor.setAccessible(true);
        return constructor;
    }

    private static ConstructorSignature inspect(String typeName, Constructor<?> constructor) {
        boolean acceptsSubject = false;
        List<String> names = new ArrayList<>();
        for (Parameter parameter : constructor.getParameters()) {
            if (parameter.getType() == Backend.class) {
                continue;
            }
            if (parameter.isAnnotationPresent(Subject.class)) {
                if (acceptsSubject || parameter.getType() != String.class) {
                    throw new IllegalStateException(typeName + " must declare at most one String @Subject parameter");
                }
                acceptsSubject = true;
                continue;
            }
            Param param = parameter.getAnnotation(Param.class);
            if (param == null) {
                throw new IllegalStateException(typeName + " has a constructor parameter without @Subject or @Param");
            }
            if (parameter.getType().isPrimitive()) {
                throw new IllegalStateException(typeName + " parameter " + param.value() + " must use a reference type");
            }
            names.add(param.value());
        }
        return new ConstructorSignature(acceptsSubject, names);
    }
}
