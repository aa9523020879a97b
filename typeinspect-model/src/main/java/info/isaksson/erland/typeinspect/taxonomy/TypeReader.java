package info.isaksson.erland.typeinspect.taxonomy;

import info.isaksson.erland.typeinspect.annotations.Literal;
import info.isaksson.erland.typeinspect.annotations.OneOf;
import info.isaksson.erland.typeinspect.model.TypeDescriptor;
import info.isaksson.erland.typeinspect.model.Unset;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedParameterizedType;
import java.lang.reflect.AnnotatedType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads reflective types into {@link TypeDescriptor}s.
 *
 * <p>Recognized type-use annotations:</p>
 * <ul>
 *   <li>{@link Literal}: fixed value set on the annotated base type</li>
 *   <li>{@link OneOf}: union of the listed types</li>
 *   <li>any annotation with simple name {@code Nullable}: adds the null branch</li>
 * </ul>
 * Unions that end up with a single branch are collapsed to that branch.
 */
public final class TypeReader {

    private static final String NULLABLE = "Nullable";

    private TypeReader() {}

    public static TypeDescriptor read(Class<?> type) {
        if (type == null) return TypeDescriptor.unset();
        if (type.isEnum()) return enumOf(type);
        return TypeDescriptor.plain(type);
    }

    public static TypeDescriptor read(Type type) {
        if (type == null) return TypeDescriptor.unset();
        if (type instanceof Class<?>) return read((Class<?>) type);
        if (type instanceof ParameterizedType) {
            ParameterizedType pt = (ParameterizedType) type;
            List<TypeDescriptor> args = new ArrayList<>();
            for (Type arg : pt.getActualTypeArguments()) args.add(read(arg));
            return TypeDescriptor.generic((Class<?>) pt.getRawType(), args);
        }
        // type variables, wildcards and generic arrays are kept by name
        return TypeDescriptor.plain(type.getTypeName());
    }

    public static TypeDescriptor read(AnnotatedType annotated) {
        if (annotated == null) return TypeDescriptor.unset();

        TypeDescriptor base;
        if (annotated instanceof AnnotatedParameterizedType) {
            AnnotatedParameterizedType apt = (AnnotatedParameterizedType) annotated;
            List<TypeDescriptor> args = new ArrayList<>();
            for (AnnotatedType arg : apt.getAnnotatedActualTypeArguments()) args.add(read(arg));
            Class<?> raw = (Class<?>) ((ParameterizedType) apt.getType()).getRawType();
            base = TypeDescriptor.generic(raw, args);
        } else {
            base = read(annotated.getType());
        }

        Literal literal = annotated.getAnnotation(Literal.class);
        if (literal != null) {
            Class<?> baseClass = annotated.getType() instanceof Class<?> ? (Class<?>) annotated.getType() : null;
            base = literalOf(baseClass, literal.value());
        }

        OneOf oneOf = annotated.getAnnotation(OneOf.class);
        if (oneOf != null) {
            List<TypeDescriptor> branches = new ArrayList<>();
            if (literal != null) branches.add(base);
            for (Class<?> c : oneOf.value()) branches.add(read(c));
            base = TypeDescriptor.union(branches);
        }

        if (isNullable(annotated)) {
            base = TypeDescriptor.union(base, TypeDescriptor.nullType());
        }
        return collapse(base);
    }

    /**
     * Runtime type of a value: the null type for {@code null}, {@link TypeDescriptor#unset()}
     * for {@link Unset}, the declaring enum for enum constants (including constant bodies).
     */
    public static TypeDescriptor valueType(Object value) {
        if (value == null) return TypeDescriptor.nullType();
        if (Unset.isUnset(value)) return TypeDescriptor.unset();
        if (value instanceof Enum<?>) return enumOf(((Enum<?>) value).getDeclaringClass());
        return read(value.getClass());
    }

    /** Convert literal text to the base type: primitives and their boxes, else the text itself. */
    public static Object convertLiteral(Class<?> baseType, String text) {
        if (baseType == null) return text;
        try {
            if (baseType == int.class || baseType == Integer.class) return Integer.valueOf(text.trim());
            if (baseType == long.class || baseType == Long.class) return Long.valueOf(text.trim());
            if (baseType == double.class || baseType == Double.class) return Double.valueOf(text.trim());
            if (baseType == float.class || baseType == Float.class) return Float.valueOf(text.trim());
            if (baseType == short.class || baseType == Short.class) return Short.valueOf(text.trim());
            if (baseType == byte.class || baseType == Byte.class) return Byte.valueOf(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + text + "' is not a valid " + baseType.getSimpleName(), e);
        }
        if (baseType == boolean.class || baseType == Boolean.class) {
            String t = text.trim();
            if (t.equals("true") || t.equals("false")) return Boolean.valueOf(t);
            throw new IllegalArgumentException("'" + text + "' is not a valid boolean");
        }
        if (baseType == char.class || baseType == Character.class) {
            if (text.length() == 1) return text.charAt(0);
            throw new IllegalArgumentException("'" + text + "' is not a single character");
        }
        return text;
    }

    /** True when {@code annotated} carries a type-use annotation whose simple name is {@code Nullable}. */
    public static boolean isNullable(AnnotatedType annotated) {
        for (Annotation a : annotated.getAnnotations()) {
            if (NULLABLE.equals(a.annotationType().getSimpleName())) return true;
        }
        return false;
    }

    private static TypeDescriptor literalOf(Class<?> baseClass, String[] texts) {
        List<Object> values = new ArrayList<>();
        for (String text : texts) {
            Object v = convertLiteral(baseClass, text);
            if (!values.contains(v)) values.add(v);
        }
        return TypeDescriptor.literal(baseClass, values);
    }

    private static TypeDescriptor collapse(TypeDescriptor t) {
        if (TypeTaxonomy.isUnion(t) && t.args.size() == 1) return t.args.get(0);
        return t;
    }

    @SuppressWarnings("unchecked")
    private static TypeDescriptor enumOf(Class<?> type) {
        return TypeDescriptor.enumType((Class<? extends Enum<?>>) type);
    }
}
