package info.isaksson.erland.typeinspect.model;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A method or constructor of an inspected type: its {@link Signature} plus how it is invoked,
 * who may see it and where it was declared.
 */
public final class Member implements Inspectable {

    /** Member name used for constructors. */
    public static final String INIT_NAME = "<init>";

    public final Signature signature;
    /** The inspected type. */
    public final Class<?> owner;
    /** The hierarchy level that defines this member. Equals {@link #owner} unless inherited. */
    public final Class<?> declaringType;
    public final MemberKind kind;
    public final Visibility visibility;
    /** True iff {@link #owner} does not declare a member of this name itself. */
    public final boolean inherited;
    public final Executable executable;

    public Member(Signature signature,
                  Class<?> owner,
                  Class<?> declaringType,
                  MemberKind kind,
                  Visibility visibility,
                  boolean inherited,
                  Executable executable) {
        this.signature = Objects.requireNonNull(signature, "signature");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.declaringType = declaringType == null ? owner : declaringType;
        this.kind = kind == null ? MemberKind.INSTANCE : kind;
        this.visibility = visibility == null ? Visibility.PUBLIC : visibility;
        this.inherited = inherited;
        this.executable = Objects.requireNonNull(executable, "executable");
    }

    @Override
    public String name() {
        return signature.name;
    }

    @Override
    public String description() {
        return signature.description;
    }

    public List<Parameter> params() {
        return signature.parameters;
    }

    public Parameter getParam(Object key) {
        return signature.getParam(key);
    }

    public boolean isConstructor() {
        return executable instanceof Constructor<?>;
    }

    public boolean isStatic() {
        return kind == MemberKind.STATIC;
    }

    public boolean isClassMethod() {
        return kind == MemberKind.CLASS;
    }

    public boolean isProperty() {
        return kind == MemberKind.PROPERTY;
    }

    public boolean isPublic() {
        return visibility == Visibility.PUBLIC;
    }

    public boolean isProtected() {
        return visibility == Visibility.PROTECTED;
    }

    public boolean isPackagePrivate() {
        return visibility == Visibility.PACKAGE_PRIVATE;
    }

    public boolean isPrivate() {
        return visibility == Visibility.PRIVATE;
    }

    /** Instance and property members need a receiver; static and class members do not. */
    public boolean requiresInstance() {
        return !isConstructor() && (kind == MemberKind.INSTANCE || kind == MemberKind.PROPERTY);
    }

    @Override
    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>(signature.toData());
        data.put("kind", kind.name());
        data.put("visibility", visibility.name());
        data.put("inherited", inherited);
        data.put("declaringType", declaringType.getTypeName());
        return data;
    }

    @Override public String toString() {
        return "Member(name='" + name() + "', kind=" + kind + ", visibility=" + visibility
                + ", inherited=" + inherited + ", declaringType=" + declaringType.getSimpleName() + ")";
    }
}
