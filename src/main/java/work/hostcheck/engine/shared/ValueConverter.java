package work.hostcheck.engine.shared;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.lang.reflect.Type;

/**
 * Converts declaration values (YAML/JSON scalars, lists and maps) into the Java types providers declare.
 */
public final class ValueConverter {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    private ValueConverter() {}

    /**
     * @throws IllegalArgumentException when {@code value} cannot be represented as {@code target}
     */
    public static Object convert(Object value, Type target) {
        JavaType type = MAPPER.getTypeFactory().constructType(target);
        if (value == null) {
            if (type.isPrimitive()) {
                throw new IllegalArgumentException("null cannot be converted to " + type.getRawClass().getSimpleName());
            }
            return null;
        }
        if (type.getRawClass().isInstance(value) && !type.isContainerType()) {
            return value;
        }
        return MAPPER.convertValue(value, type);
    }
}
