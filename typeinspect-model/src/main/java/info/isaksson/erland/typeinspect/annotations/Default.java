package info.isaksson.erland.typeinspect.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Default value of a parameter, written as a Java literal ({@code "4"}, {@code "null"},
 * {@code "\"text\""}, {@code "'c'"}, {@code "-1.5"}).
 *
 * <p>Enum-typed parameters take the constant name; {@code String} parameters also accept
 * unquoted text.</p>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.PARAMETER})
public @interface Default {
    String value();
}
