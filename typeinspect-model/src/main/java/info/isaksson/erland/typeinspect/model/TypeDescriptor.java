package info.isaksson.erland.typeinspect.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Closed, inspectable representation of a declared type.
 *
 * <p>A descriptor is computed once from a reflective type (see
 * {@code info.isaksson.erland.typeinspect.taxonomy.TypeReader}) and downstream logic
 * switches on {@link #kind} instead of probing reflection objects again.</p>
 */
public final class TypeDescriptor {

    private static final TypeDescriptor UNSET =
            new TypeDescriptor(TypeDescriptorKind.UNSET, "", null, null, null, null);
    private static final TypeDescriptor NULL_TYPE =
            new TypeDescriptor(TypeDescriptorKind.PLAIN, "null", null, null, null, null);

    public final TypeDescriptorKind kind;

    /**
     * Qualified name: the type name for {@link TypeDescriptorKind#PLAIN} and
     * {@link TypeDescriptorKind#ENUM}, the origin for {@link TypeDescriptorKind#GENERIC},
     * the base type for {@link TypeDescriptorKind#LITERAL}. Empty for unions and unset.
     */
    public final String name;

    /** Backing class when known. Null for type variables, wildcards, unions and the null type. */
    public final Class<?> rawType;

    /** GENERIC: type arguments. UNION: flattened, de-duplicated branches. */
    public final List<TypeDescriptor> args;

    /** LITERAL: allowed values in declaration order. */
    public final List<Object> values;

    /** ENUM: constant names in declaration order. */
    public final List<String> choices;

    private TypeDescriptor(TypeDescriptorKind kind,
                           String name,
                           Class<?> rawType,
                           List<TypeDescriptor> args,
                           List<?> values,
                           List<String> choices) {
        this.kind = kind == null ? TypeDescriptorKind.UNSET : kind;
        this.name = Objects.requireNonNullElse(name, "");
        this.rawType = rawType;
        this.args = args == null ? List.of() : List.copyOf(args);
        // literal values may legitimately contain null
        this.values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
        this.choices = choices == null ? List.of() : List.copyOf(choices);
    }

    public static TypeDescriptor unset() {
        return UNSET;
    }

    /** The type of the {@code null} value. Not the same as {@link #unset()}. */
    public static TypeDescriptor nullType() {
        return NULL_TYPE;
    }

    public static TypeDescriptor plain(Class<?> type) {
        Objects.requireNonNull(type, "type");
        return new TypeDescriptor(TypeDescriptorKind.PLAIN, type.getTypeName(), type, null, null, null);
    }

    /** A plain type known only by name, e.g. a type variable or wildcard. */
    public static TypeDescriptor plain(String name) {
        return new TypeDescriptor(TypeDescriptorKind.PLAIN, name, null, null, null, null);
    }

    public static TypeDescriptor generic(Class<?> origin, List<TypeDescriptor> args) {
        Objects.requireNonNull(origin, "origin");
        return new TypeDescriptor(TypeDescriptorKind.GENERIC, origin.getTypeName(), origin, args, null, null);
    }

    /**
     * Build a union. Nested unions are expanded in place and repeated branches dropped,
     * keeping the first occurrence.
     *
     * <p>A single remaining branch still yields a union; collapsing {@code X | X} to {@code X}
     * is up to the caller.</p>
     */
    public static TypeDescriptor union(List<TypeDescriptor> branches) {
        Set<TypeDescriptor> flat = new LinkedHashSet<>();
        if (branches != null) {
            for (TypeDescriptor b : branches) {
                flattenInto(b, flat);
            }
        }
        return new TypeDescriptor(TypeDescriptorKind.UNION, "", null, new ArrayList<>(flat), null, null);
    }

    public static TypeDescriptor union(TypeDescriptor... branches) {
        return union(List.of(branches));
    }

    public static TypeDescriptor literal(Class<?> baseType, List<?> values) {
        String baseName = baseType == null ? "" : baseType.getTypeName();
        return new TypeDescriptor(TypeDescriptorKind.LITERAL, baseName, baseType, null, values, null);
    }

    public static TypeDescriptor enumType(Class<? extends Enum<?>> enumClass) {
        Objects.requireNonNull(enumClass, "enumClass");
        List<String> names = new ArrayList<>();
        for (Enum<?> constant : enumClass.getEnumConstants()) {
            names.add(constant.name());
        }
        return new TypeDescriptor(TypeDescriptorKind.ENUM, enumClass.getTypeName(), enumClass, null, null, names);
    }

    public boolean isUnset() {
        return kind == TypeDescriptorKind.UNSET;
    }

    public boolean isNullType() {
        return this == NULL_TYPE || (kind == TypeDescriptorKind.PLAIN && rawType == null && "null".equals(name));
    }

    private static void flattenInto(TypeDescriptor t, Set<TypeDescriptor> out) {
        if (t == null) return;
        if (t.kind == TypeDescriptorKind.UNION) {
            for (TypeDescriptor branch : t.args) {
                flattenInto(branch, out);
            }
        } else {
            out.add(t);
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeDescriptor)) return false;
        TypeDescriptor that = (TypeDescriptor) o;
        return kind == that.kind &&
                Objects.equals(name, that.name) &&
                Objects.equals(args, that.args) &&
                Objects.equals(values, that.values) &&
                Objects.equals(choices, that.choices);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, name, args, values, choices);
    }

    @Override public String toString() {
        switch (kind) {
            case UNSET:
                return Unset.INSTANCE.toString();
            case UNION:
                return "UNION" + args;
            case GENERIC:
                return name + "<" + args + ">";
            case LITERAL:
                return "LITERAL" + values;
            case ENUM:
                return name + choices;
            default:
                return name;
        }
    }
}
