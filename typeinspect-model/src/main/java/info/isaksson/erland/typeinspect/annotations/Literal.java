package info.isaksson.erland.typeinspect.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Restricts the annotated type to a fixed set of values.
 *
 * <p>Values are written as text and converted to the annotated base type when it is a
 * primitive, a boxed primitive or {@code String}:</p>
 * <pre>{@code
 * void open(@Literal({"r", "w"}) String mode, @Literal({"1", "2", "3"}) int level)
 * }</pre>
 * An empty value list marks the type as a literal without making it one.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE_USE})
public @interface Literal {
    String[] value();
}
