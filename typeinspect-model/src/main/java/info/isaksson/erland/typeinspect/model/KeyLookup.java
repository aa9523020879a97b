package info.isaksson.erland.typeinspect.model;

import info.isaksson.erland.typeinspect.error.IndexOutOfRangeException;
import info.isaksson.erland.typeinspect.error.InvalidKeyTypeException;
import info.isaksson.erland.typeinspect.error.NotFoundException;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Name / index / untyped-key lookup shared by signatures and class metadata.
 */
public final class KeyLookup {

    private KeyLookup() {}

    public static <T> T byName(String name, Map<String, T> byName, String what) {
        T found = name == null ? null : byName.get(name);
        if (found == null) throw new NotFoundException(what, name);
        return found;
    }

    public static <T> T byIndex(int index, List<T> ordered, String what) {
        if (index < 0 || index >= ordered.size()) {
            throw new IndexOutOfRangeException(what, index, ordered.size());
        }
        return ordered.get(index);
    }

    /**
     * Dispatch on the runtime type of {@code key}: a {@link String} name, or an integral
     * {@link Number} ({@code Byte}, {@code Short}, {@code Integer}, {@code Long}, {@code BigInteger})
     * used as an index.
     */
    public static <T> T byKey(Object key, Map<String, T> byName, List<T> ordered, String what) {
        if (key instanceof String) return byName((String) key, byName, what);
        if (isIntegral(key)) {
            Number n = (Number) key;
            if (key instanceof BigInteger && ((BigInteger) key).bitLength() >= Long.SIZE) {
                throw new IndexOutOfRangeException(what, ((BigInteger) key).signum() < 0 ? Long.MIN_VALUE : Long.MAX_VALUE, ordered.size());
            }
            long index = n.longValue();
            if (index < 0 || index >= ordered.size()) {
                throw new IndexOutOfRangeException(what, index, ordered.size());
            }
            return ordered.get((int) index);
        }
        throw new InvalidKeyTypeException(key);
    }

    private static boolean isIntegral(Object key) {
        return key instanceof Integer
                || key instanceof Long
                || key instanceof Short
                || key instanceof Byte
                || key instanceof BigInteger;
    }
}
