package work.hostcheck.engine.resource;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import work.hostcheck.engine.shared.CaseConverter;

/**
 * Annotated members of a provider class, split into type-level and instance-level lookups.
 */
final class MemberTable {
    private static final Map<Class<?>, MemberTable> CACHE = new ConcurrentHashMap<>();

    private final Map<String, ResourceMember> typeMembers;
    private final Map<String, ResourceMember> instanceMembers;

    private MemberTable(Map<String, ResourceMember> typeMembers, Map<String, ResourceMember> instanceMembers) {
        this.typeMembers = Collections.unmodifiableMap(typeMembers);
        this.instanceMembers = Collections.unmodifiableMap(instanceMembers);
    }

    static MemberTable of(Class<?> type) {
        return CACHE.computeIfAbsent(type, MemberTable::scan);
    }

    Map<String, ResourceMember> typeMembers() {
        return typeMembers;
    }

    Map<String, ResourceMember> instanceMembers() {
        return instanceMembers;
    }

    private static MemberTable scan(Class<?> type) {
        var typeLevel = new LinkedHashMap<String, ResourceMember>();
        var instanceLevel = new LinkedHashMap<String, ResourceMember>();
        for (Method method : type.getMethods()) {
            if (Modifier.isStatic(method.getModifiers()) || method.isBridge() || method.isSynthetic()) {
                continue;
            }
            Attribute attribute = method.getAnnotation(Attribute.class);
            Operation operation = method.getAnnotation(Operation.class);
            if (attribute != null && operation != null) {
                throw new IllegalStateException(describe(type, method) + " cannot be both @Attribute and @Operation");
            }
            if (attribute != null) {
                if (method.getParameterCount() != 0) {
                    throw new IllegalStateException(describe(type, method) + " is an @Attribute and must take no arguments");
                }
                method.setAccessible(true);
                String name = memberName(attribute.value(), method.getName());
                putUnique(type, typeLevel, ResourceMember.attribute(name, method));
            } else if (operation != null) {
                if (method.getParameterCount() != 1) {
                    throw new IllegalStateException(describe(type, method) + " is an @Operation and must take one argument");
                }
                method.setAccessible(true);
                String name = memberName(operation.value(), method.getName());
                putUnique(type, typeLevel, ResourceMember.operation(name, method));
            }
        }
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                Attribute attribute = field.getAnnotation(Attribute.class);
                if (attribute == null) {
                    continue;
                }
                field.setAccessible(true);
                String name = memberName(attribute.value(), field.getName());
                var member = ResourceMember.value(name, field);
                // subclass fields win over inherited ones
                if (member.isStatic()) {
                    typeLevel.putIfAbsent(name, member);
                } else {
                    instanceLevel.putIfAbsent(name, member);
                }
            }
        }
        return new MemberTable(typeLevel, instanceLevel);
    }

    private static void putUnique(Class<?> type, Map<String, ResourceMember> members, ResourceMember member) {
        ResourceMember previous = members.putIfAbsent(member.name(), member);
        if (previous != null) {
            throw new IllegalStateException(type.getName() + " exposes more than one member named " + member.name());
        }
    }

    private static String memberName(String declared, String javaName) {
        return declared == null || declared.isBlank() ? CaseConverter.camelToSnake(javaName) : declared;
    }

    private static String describe(Class<?> type, Method method) {
        return type.getSimpleName() + "." + method.getName();
    }
}
