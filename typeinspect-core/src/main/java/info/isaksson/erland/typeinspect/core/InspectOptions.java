package info.isaksson.erland.typeinspect.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Options for inspecting classes and callables.
 *
 * <p>The member flags say which members a {@link ClassMetadata} lists. Turning a flag on never
 * removes a member name that was listed with the flag off.</p>
 */
public final class InspectOptions {
    /** List the constructor as {@code <init>}. */
    public boolean init = true;
    public boolean publicMembers = true;
    /** List members whose defining type is a supertype of the inspected one. */
    public boolean inherited = true;
    public boolean staticMethods = true;
    /** Static factory methods returning the defining type. */
    public boolean classMethods = true;
    public boolean protectedMembers = false;
    public boolean packagePrivate = false;
    public boolean privateMembers = false;

    /** Leave the receiver ({@code this}) of instance methods out of their parameter lists. */
    public boolean skipReceiver = true;

    /** Give untyped parameters the runtime type of their default value. */
    public boolean inferTypes = true;

    /** Read documentation from {@code @Doc} annotations. */
    public boolean useDocAnnotations = true;

    /**
     * Source roots searched for Javadoc, in order. Annotations win over source Javadoc
     * when both are present.
     */
    public List<Path> sourceRoots = new ArrayList<>();

    public InspectOptions copy() {
        InspectOptions o = new InspectOptions();
        o.init = init;
        o.publicMembers = publicMembers;
        o.inherited = inherited;
        o.staticMethods = staticMethods;
        o.classMethods = classMethods;
        o.protectedMembers = protectedMembers;
        o.packagePrivate = packagePrivate;
        o.privateMembers = privateMembers;
        o.skipReceiver = skipReceiver;
        o.inferTypes = inferTypes;
        o.useDocAnnotations = useDocAnnotations;
        o.sourceRoots = sourceRoots == null ? new ArrayList<>() : new ArrayList<>(sourceRoots);
        return o;
    }
}
