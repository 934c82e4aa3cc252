package work.hostcheck.engine.member;

import java.lang.reflect.Type;

/**
 * How a resolved member is read: a computed attribute already evaluated, an operation waiting for its
 * argument, or a plain value.
 */
public interface MemberKind {
    String name();

    record ComputedAttribute(String name, Object value) implements MemberKind {}

    record Operation(String name, Type parameterType, Invoker invoker) implements MemberKind {
        public Object invoke(Object argument) {
            return invoker.invoke(argument);
        }
    }

    record PlainValue(String name, Object value) implements MemberKind {}

    @FunctionalInterface
    interface Invoker {
        Object invoke(Object argument);
    }
}
