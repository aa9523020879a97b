package info.isaksson.erland.typeinspect.core;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the types consulted when resolving a member name, most-derived first.
 *
 * <p>Order: the inspected type, its superclass chain, then all interfaces breadth-first.
 * Platform types ({@code java.*}, {@code javax.*}, {@code jdk.*}, {@code sun.*}) are left out
 * unless they are the inspected type itself. Each level keeps the methods it declares that a
 * caller of the inspected type can reach by name: no synthetic or bridge methods, private
 * methods only on the inspected type, static interface methods only on the inspected type.</p>
 */
public final class TypeHierarchy {

    private static final List<String> PLATFORM_PREFIXES = List.of("java.", "javax.", "jdk.", "sun.");

    private static final Comparator<Method> METHOD_ORDER = Comparator
            .comparing(Method::getName)
            .thenComparing(TypeHierarchy::parameterSignature);

    public final Class<?> owner;
    /** Most- to least-derived. Starts with {@link #owner}. */
    public final List<Class<?>> levels;

    private final Map<Class<?>, List<Method>> declared;

    private TypeHierarchy(Class<?> owner, List<Class<?>> levels, Map<Class<?>, List<Method>> declared) {
        this.owner = owner;
        this.levels = List.copyOf(levels);
        this.declared = declared;
    }

    public static TypeHierarchy of(Class<?> owner) {
        Objects.requireNonNull(owner, "owner");

        Set<Class<?>> ordered = new LinkedHashSet<>();
        ordered.add(owner);
        List<Class<?>> chain = new ArrayList<>();
        for (Class<?> c = owner; c != null; c = c.getSuperclass()) {
            chain.add(c);
            if (c != owner && !isPlatformType(c)) ordered.add(c);
        }

        Deque<Class<?>> queue = new ArrayDeque<>();
        for (Class<?> c : chain) queue.addAll(Arrays.asList(c.getInterfaces()));
        while (!queue.isEmpty()) {
            Class<?> i = queue.removeFirst();
            if (isPlatformType(i) || ordered.contains(i)) continue;
            ordered.add(i);
            queue.addAll(Arrays.asList(i.getInterfaces()));
        }

        Map<Class<?>, List<Method>> declared = new LinkedHashMap<>();
        for (Class<?> level : ordered) {
            List<Method> methods = new ArrayList<>();
            for (Method m : level.getDeclaredMethods()) {
                if (reachable(owner, level, m)) methods.add(m);
            }
            methods.sort(METHOD_ORDER);
            declared.put(level, List.copyOf(methods));
        }
        return new TypeHierarchy(owner, new ArrayList<>(ordered), declared);
    }

    /** Methods {@code level} declares that are visible through the owner, sorted by name and parameter types. */
    public List<Method> declaredMethods(Class<?> level) {
        return declared.getOrDefault(level, List.of());
    }

    /** True iff {@code level} declares a reachable method named {@code name}. */
    public boolean declares(Class<?> level, String name) {
        for (Method m : declaredMethods(level)) {
            if (m.getName().equals(name)) return true;
        }
        return false;
    }

    /** First level, most-derived first, declaring {@code name}. */
    public Optional<Class<?>> definingLevel(String name) {
        for (Class<?> level : levels) {
            if (declares(level, name)) return Optional.of(level);
        }
        return Optional.empty();
    }

    public static boolean isPlatformType(Class<?> type) {
        if (type.isPrimitive()) return true;
        String n = type.getName();
        for (String prefix : PLATFORM_PREFIXES) {
            if (n.startsWith(prefix)) return true;
        }
        return false;
    }

    static String parameterSignature(Method m) {
        StringBuilder sb = new StringBuilder();
        for (Class<?> p : m.getParameterTypes()) sb.append(p.getTypeName()).append(',');
        return sb.toString();
    }

    private static boolean reachable(Class<?> owner, Class<?> level, Method m) {
        if (m.isSynthetic() || m.isBridge()) return false;
        if (level == owner) return true;
        if (Modifier.isPrivate(m.getModifiers())) return false;
        return !(level.isInterface() && Modifier.isStatic(m.getModifiers()));
    }

    @Override public String toString() {
        List<String> names = new ArrayList<>();
        for (Class<?> c : levels) names.add(c.getSimpleName());
        return "TypeHierarchy(" + String.join(" > ", names) + ")";
    }
}
