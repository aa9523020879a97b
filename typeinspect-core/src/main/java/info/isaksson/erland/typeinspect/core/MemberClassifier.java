package info.isaksson.erland.typeinspect.core;

import info.isaksson.erland.typeinspect.model.MemberKind;
import info.isaksson.erland.typeinspect.model.Visibility;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.Objects;

/**
 * Decides kind, visibility and origin of a member from a {@link TypeHierarchy} snapshot.
 *
 * <p>Kind precedence: {@code CLASS > STATIC > PROPERTY > INSTANCE}.</p>
 */
public final class MemberClassifier {

    private MemberClassifier() {}

    public static final class Classification {
        public final MemberKind kind;
        public final Visibility visibility;
        public final boolean inherited;
        /** The hierarchy level that defines the member. */
        public final Class<?> definingType;

        public Classification(MemberKind kind, Visibility visibility, boolean inherited, Class<?> definingType) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.visibility = Objects.requireNonNull(visibility, "visibility");
            this.inherited = inherited;
            this.definingType = Objects.requireNonNull(definingType, "definingType");
        }

        @Override public String toString() {
            return "Classification(" + kind + ", " + visibility + ", inherited=" + inherited
                    + ", definingType=" + definingType.getSimpleName() + ")";
        }
    }

    /**
     * @param name       the member name ({@code <init>} for constructors)
     * @param executable the method or constructor found under that name
     * @param hierarchy  snapshot of the inspected type
     */
    public static Classification classify(String name, Executable executable, TypeHierarchy hierarchy) {
        Objects.requireNonNull(executable, "executable");
        Objects.requireNonNull(hierarchy, "hierarchy");
        Visibility visibility = visibilityOf(executable.getModifiers());

        if (executable instanceof Constructor<?>) {
            return new Classification(MemberKind.INSTANCE, visibility, false, executable.getDeclaringClass());
        }

        Method method = (Method) executable;
        Class<?> definingType = hierarchy.definingLevel(name).orElse(method.getDeclaringClass());
        boolean inherited = !hierarchy.declares(hierarchy.owner, name);
        return new Classification(kindOf(method, definingType), visibility, inherited, definingType);
    }

    static MemberKind kindOf(Method method, Class<?> definingType) {
        if (Modifier.isStatic(method.getModifiers())) {
            return isClassMethod(method, definingType) ? MemberKind.CLASS : MemberKind.STATIC;
        }
        return isProperty(method, definingType) ? MemberKind.PROPERTY : MemberKind.INSTANCE;
    }

    /** Static factory: returns the defining type or one of its subtypes. */
    static boolean isClassMethod(Method method, Class<?> definingType) {
        Class<?> returned = method.getReturnType();
        return Modifier.isStatic(method.getModifiers())
                && !returned.isPrimitive()
                && definingType.isAssignableFrom(returned);
    }

    /** Zero-argument {@code getX()}, boolean {@code isX()} or record accessor. */
    static boolean isProperty(Method method, Class<?> definingType) {
        if (Modifier.isStatic(method.getModifiers()) || method.getParameterCount() != 0) return false;
        Class<?> returned = method.getReturnType();
        if (returned == void.class) return false;

        String n = method.getName();
        if (n.length() > 3 && n.startsWith("get") && Character.isUpperCase(n.charAt(3))) return true;
        if (n.length() > 2 && n.startsWith("is") && Character.isUpperCase(n.charAt(2))) {
            return returned == boolean.class || returned == Boolean.class;
        }
        if (definingType.isRecord()) {
            for (RecordComponent rc : definingType.getRecordComponents()) {
                if (rc.getName().equals(n)) return true;
            }
        }
        return false;
    }

    public static Visibility visibilityOf(int modifiers) {
        if (Modifier.isPublic(modifiers)) return Visibility.PUBLIC;
        if (Modifier.isProtected(modifiers)) return Visibility.PROTECTED;
        if (Modifier.isPrivate(modifiers)) return Visibility.PRIVATE;
        return Visibility.PACKAGE_PRIVATE;
    }
}
