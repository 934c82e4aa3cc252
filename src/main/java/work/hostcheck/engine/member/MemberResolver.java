package work.hostcheck.engine.member;

import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.hostcheck.engine.resource.ResourceHandle;
import work.hostcheck.engine.resource.ResourceMember;
import work.hostcheck.engine.shared.ValueConverter;

/**
 * Finds a member on a resource (type level first, then instance level) and classifies it.
 */
public final class MemberResolver {
    static final String PARAMETER_KEY = "parameter";

    private static final Logger log = LoggerFactory.getLogger(MemberResolver.class);

    /**
     * @throws UnknownMemberException when neither the type nor the instance exposes {@code memberName}
     * @throws MemberInvocationException when a computed attribute throws
     */
    public MemberKind resolve(ResourceHandle handle, Object instance, String memberName) {
        log.debug("Trying to call {} on {}", memberName, handle);
        ResourceMember member = handle.typeMember(memberName)
            .or(() -> handle.instanceMember(instance, memberName))
            .orElseThrow(() -> new UnknownMemberException(handle.typeName(), memberName));
        return switch (member.kind()) {
            case ATTRIBUTE -> new MemberKind.ComputedAttribute(memberName, read(handle, instance, member));
            case OPERATION -> new MemberKind.Operation(
                memberName,
                member.parameterType(),
                argument -> invoke(handle, instance, member, argument)
            );
            case VALUE -> new MemberKind.PlainValue(memberName, read(handle, instance, member));
        };
    }

    /**
     * Produces the actual result of a resolved member for the given expectation. Operations take their
     * argument from the expectation's {@code parameter} entry.
     *
     * @throws MissingArgumentException when an operation has no {@code parameter} to call it with
     */
    public Object result(ResourceHandle handle, MemberKind kind, Object expectation) {
        if (kind instanceof MemberKind.ComputedAttribute attribute) {
            return attribute.value();
        }
        if (kind instanceof MemberKind.PlainValue value) {
            return value.value();
        }
        var operation = (MemberKind.Operation) kind;
        if (!(expectation instanceof Map<?, ?> arguments) || arguments.isEmpty()) {
            throw new MissingArgumentException(
                operation.name() + " is an operation of the " + handle.typeName() + " resource. An argument mapping is required."
            );
        }
        if (!arguments.containsKey(PARAMETER_KEY)) {
            throw new MissingArgumentException(
                "The argument mapping supplied has no key named \"" + PARAMETER_KEY + "\": " + arguments
            );
        }
        return operation.invoke(arguments.get(PARAMETER_KEY));
    }

    private static Object read(ResourceHandle handle, Object instance, ResourceMember member) {
        try {
            return member.read(instance);
        } catch (InvocationTargetException ex) {
            throw failure(handle, member, ex.getCause() == null ? ex : ex.getCause());
        } catch (IllegalAccessException ex) {
            throw failure(handle, member, ex);
        }
    }

    private static Object invoke(ResourceHandle handle, Object instance, ResourceMember member, Object argument) {
        Object converted;
        try {
            converted = ValueConverter.convert(argument, member.parameterType());
        } catch (IllegalArgumentException ex) {
            throw new MissingArgumentException(
                "The parameter of " + member.name() + " cannot be converted to " + member.parameterType().getTypeName()
                    + ": " + ex.getMessage()
            );
        }
        try {
            return member.invoke(instance, converted);
        } catch (InvocationTargetException ex) {
            throw failure(handle, member, ex.getCause() == null ? ex : ex.getCause());
        } catch (IllegalAccessException ex) {
            throw failure(handle, member, ex);
        }
    }

    private static MemberInvocationException failure(ResourceHandle handle, ResourceMember member, Throwable cause) {
        String detail = cause.getMessage() == null || cause.getMessage().isBlank()
            ? cause.getClass().getSimpleName()
            : cause.getMessage();
        return new MemberInvocationException(
            "Calling " + member.name() + " on the " + handle.typeName() + " resource failed: " + detail,
            cause
        );
    }
}
