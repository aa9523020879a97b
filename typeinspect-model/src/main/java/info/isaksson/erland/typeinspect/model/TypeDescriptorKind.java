package info.isaksson.erland.typeinspect.model;

/**
 * Closed set of categories a {@link TypeDescriptor} can belong to.
 */
public enum TypeDescriptorKind {
    /** No type was declared. */
    UNSET,
    /** A single named type like {@code String}, {@code int[]}, {@code T} or the null type. */
    PLAIN,
    /** Alternatives like {@code String | Integer | null}. Branches are always flattened. */
    UNION,
    /** A parameterized container like {@code List<String>} or {@code Map<K,V>}. */
    GENERIC,
    /** A fixed set of concrete values like {@code Literal["a", "b"]}. */
    LITERAL,
    /** A Java enum type, restricted to its constant names. */
    ENUM
}
