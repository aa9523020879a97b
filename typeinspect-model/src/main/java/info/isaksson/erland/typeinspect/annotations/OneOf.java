package info.isaksson.erland.typeinspect.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the annotated type as a union of the listed types, usually on {@code Object}:
 * <pre>{@code
 * void put(@OneOf({String.class, Integer.class}) Object value)
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE_USE})
public @interface OneOf {
    Class<?>[] value();
}
