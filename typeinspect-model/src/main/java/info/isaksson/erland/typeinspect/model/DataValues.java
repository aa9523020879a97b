package info.isaksson.erland.typeinspect.model;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts arbitrary values (defaults, literal values) into data-projection primitives.
 */
public final class DataValues {

    private DataValues() {}

    public static Object toData(Object value) {
        if (value == null || Unset.isUnset(value)) return null;
        if (value instanceof String || value instanceof Number || value instanceof Boolean) return value;
        if (value instanceof Character) return value.toString();
        if (value instanceof Enum<?>) return ((Enum<?>) value).name();
        if (value instanceof Class<?>) return ((Class<?>) value).getTypeName();
        if (value instanceof Collection<?>) {
            List<Object> out = new ArrayList<>();
            for (Object v : (Collection<?>) value) out.add(toData(v));
            return out;
        }
        if (value.getClass().isArray()) {
            int n = Array.getLength(value);
            List<Object> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) out.add(toData(Array.get(value, i)));
            return out;
        }
        if (value instanceof Map<?, ?>) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                out.put(String.valueOf(e.getKey()), toData(e.getValue()));
            }
            return out;
        }
        return String.valueOf(value);
    }

    /** Source-like text form of a value: strings quoted, chars single-quoted. */
    public static String render(Object value) {
        if (value instanceof String) return "\"" + value + "\"";
        if (value instanceof Character) return "'" + value + "'";
        if (value instanceof Enum<?>) return ((Enum<?>) value).name();
        return String.valueOf(value);
    }
}
