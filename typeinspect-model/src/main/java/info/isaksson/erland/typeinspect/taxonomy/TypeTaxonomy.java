package info.isaksson.erland.typeinspect.taxonomy;

import info.isaksson.erland.typeinspect.model.DataValues;
import info.isaksson.erland.typeinspect.model.TypeDescriptor;
import info.isaksson.erland.typeinspect.model.TypeDescriptorKind;
import info.isaksson.erland.typeinspect.model.Unset;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classification and decomposition of {@link TypeDescriptor}s.
 *
 * <p>Everything here switches on {@link TypeDescriptor#kind}. Normalizing a one-branch union
 * ({@code X | X}) down to {@code X} is the caller's job ({@link TypeReader} does it);
 * {@link #isUnion} reports the tag as is.</p>
 */
public final class TypeTaxonomy {

    /** Package / enclosing-type prefixes: {@code java.util.}, {@code Outer$}. */
    private static final Pattern QUALIFIER = Pattern.compile("\\b(?:[A-Za-z_][A-Za-z0-9_]*[.$])+(?=[A-Za-z_])");

    private TypeTaxonomy() {}

    public static boolean isUnion(TypeDescriptor t) {
        return t != null && t.kind == TypeDescriptorKind.UNION;
    }

    /** Branches of a union, or an empty list for anything else. */
    public static List<TypeDescriptor> unionBranches(TypeDescriptor t) {
        return isUnion(t) ? t.args : List.of();
    }

    /**
     * Expand nested union branches into one linear, de-duplicated, order-preserving union.
     * Non-union descriptors are returned unchanged. Idempotent.
     */
    public static TypeDescriptor flattenUnion(TypeDescriptor t) {
        if (!isUnion(t)) return t;
        Set<TypeDescriptor> out = new LinkedHashSet<>();
        collectBranches(t, out);
        return TypeDescriptor.union(new ArrayList<>(out));
    }

    public static boolean isGenericContainer(TypeDescriptor t) {
        return t != null && t.kind == TypeDescriptorKind.GENERIC;
    }

    /** True for a literal with at least one value; the bare marker is not a literal. */
    public static boolean isDirectLiteral(TypeDescriptor t) {
        return t != null && t.kind == TypeDescriptorKind.LITERAL && !t.values.isEmpty();
    }

    /** Like {@link #isDirectLiteral} but also looks through union branches. */
    public static boolean isOrContainsLiteral(TypeDescriptor t) {
        if (isDirectLiteral(t)) return true;
        for (TypeDescriptor branch : unionBranches(t)) {
            if (isOrContainsLiteral(branch)) return true;
        }
        return false;
    }

    public static boolean isEnum(TypeDescriptor t) {
        return t != null && t.kind == TypeDescriptorKind.ENUM;
    }

    /**
     * Values a type is restricted to.
     *
     * <ul>
     *   <li>literal: its values</li>
     *   <li>enum: its constant names</li>
     *   <li>union: the choices of every literal or enum branch, first seen first, without
     *       duplicates (possibly empty)</li>
     *   <li>anything else: empty optional</li>
     * </ul>
     */
    public static Optional<List<Object>> getChoices(TypeDescriptor t) {
        if (isDirectLiteral(t)) return Optional.of(t.values);
        if (isEnum(t)) return Optional.of(new ArrayList<Object>(t.choices));
        if (isUnion(t)) {
            Set<Object> out = new LinkedHashSet<>();
            for (TypeDescriptor branch : t.args) {
                if (isDirectLiteral(branch)) {
                    out.addAll(branch.values);
                } else if (isEnum(branch)) {
                    out.addAll(branch.choices);
                }
            }
            return Optional.of(new ArrayList<>(out));
        }
        return Optional.empty();
    }

    /** Values of a literal, or of the first literal branch of a union. */
    public static List<Object> literalChoices(TypeDescriptor t) {
        if (isDirectLiteral(t)) return t.values;
        for (TypeDescriptor branch : unionBranches(t)) {
            if (isDirectLiteral(branch)) return branch.values;
        }
        throw new IllegalArgumentException(renderName(t) + " is not a literal");
    }

    public static boolean literalContains(TypeDescriptor t, Object value) {
        if (t == null || t.kind != TypeDescriptorKind.LITERAL) {
            throw new IllegalArgumentException(renderName(t) + " is not a literal");
        }
        if (t.values.isEmpty()) {
            throw new IllegalArgumentException(renderName(t) + " has no values");
        }
        return t.values.contains(value);
    }

    /**
     * Collapse parameterized types to their bare origin ({@code List<String>} becomes
     * {@code List}); a union becomes the union of its simplified branches.
     */
    public static TypeDescriptor simplify(TypeDescriptor t) {
        if (t == null) return TypeDescriptor.unset();
        if (isGenericContainer(t)) return TypeDescriptor.plain(t.rawType);
        if (isUnion(t)) {
            List<TypeDescriptor> simplified = new ArrayList<>();
            for (TypeDescriptor branch : t.args) simplified.add(simplify(branch));
            return TypeDescriptor.union(simplified);
        }
        return t;
    }

    /**
     * Human-readable name without package or enclosing-type qualification.
     * Unions render as {@code A | B | C}.
     */
    public static String renderName(TypeDescriptor t) {
        if (t == null) return Unset.INSTANCE.toString();
        switch (t.kind) {
            case UNSET:
                return Unset.INSTANCE.toString();
            case UNION:
                return t.args.stream().map(TypeTaxonomy::renderName).collect(Collectors.joining(" | "));
            case GENERIC:
                return stripQualifiers(t.name) + t.args.stream()
                        .map(TypeTaxonomy::renderName)
                        .collect(Collectors.joining(", ", "<", ">"));
            case LITERAL:
                return t.values.stream()
                        .map(DataValues::render)
                        .collect(Collectors.joining(", ", "Literal[", "]"));
            default:
                return stripQualifiers(t.name);
        }
    }

    /**
     * Like {@link #renderName} but a union with the null type renders as {@code A?}
     * (or {@code (A | B)?}).
     */
    public static String renderSimplified(TypeDescriptor t) {
        if (!isUnion(t)) return renderName(t);
        List<TypeDescriptor> nonNull = t.args.stream()
                .filter(b -> !b.isNullType())
                .collect(Collectors.toList());
        if (nonNull.size() == t.args.size() || nonNull.isEmpty()) return renderName(t);
        if (nonNull.size() == 1) return renderName(nonNull.get(0)) + "?";
        return "(" + renderName(TypeDescriptor.union(nonNull)) + ")?";
    }

    /** Runtime type of a value; {@code null} gives the null type. */
    public static TypeDescriptor describeValueType(Object value) {
        return TypeReader.valueType(value);
    }

    /** Arrays, {@link Iterable}s and {@link Map}s. */
    public static boolean isIterable(TypeDescriptor t) {
        Class<?> raw = containerClass(t);
        if (raw == null) return false;
        return raw.isArray() || Iterable.class.isAssignableFrom(raw) || Map.class.isAssignableFrom(raw);
    }

    public static boolean isMapping(TypeDescriptor t) {
        Class<?> raw = containerClass(t);
        return raw != null && Map.class.isAssignableFrom(raw);
    }

    static String stripQualifiers(String name) {
        if (name == null || name.isEmpty()) return "";
        return QUALIFIER.matcher(name).replaceAll("");
    }

    private static Class<?> containerClass(TypeDescriptor t) {
        if (t == null) return null;
        if (t.kind == TypeDescriptorKind.PLAIN || t.kind == TypeDescriptorKind.GENERIC) return t.rawType;
        return null;
    }

    private static void collectBranches(TypeDescriptor t, Set<TypeDescriptor> out) {
        if (isUnion(t)) {
            for (TypeDescriptor branch : t.args) collectBranches(branch, out);
        } else {
            out.add(t);
        }
    }
}
