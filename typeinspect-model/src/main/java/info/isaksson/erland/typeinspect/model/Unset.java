package info.isaksson.erland.typeinspect.model;

/**
 * Marker for "no value was supplied or declared".
 *
 * <p>Distinct from {@code null}: a parameter whose default is {@code null} has a default,
 * a parameter whose default is {@link #INSTANCE} has none.</p>
 */
public enum Unset {
    INSTANCE;

    public static boolean isUnset(Object value) {
        return value == INSTANCE;
    }

    @Override
    public String toString() {
        return "Unset";
    }
}
