package info.isaksson.erland.typeinspect.model;

/** Invocation kind of a class member. */
public enum MemberKind {
    /** Needs a receiver. Constructors are reported with this kind too. */
    INSTANCE,
    /** A static method that is not a factory of its own type. */
    STATIC,
    /** A static factory: static and returning the type that defines it (or a subtype). */
    CLASS,
    /** A zero-argument getter or record accessor. */
    PROPERTY
}
