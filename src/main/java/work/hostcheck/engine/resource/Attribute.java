package work.hostcheck.engine.resource;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Exposes a member to declared checks.
 * <p>
 * On a no-argument method the member is a computed attribute. On a field it is a plain value:
 * static fields are resolved on the resource type, instance fields on the constructed resource.
 * The check name defaults to the snake_case form of the Java member name.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.FIELD})
public @interface Attribute {
    String value() default "";
}
