package info.isaksson.erland.typeinspect.doc.fixture;

import java.util.List;

/**
 * A documented fixture.
 *
 * <p>Read back by the source doc tests.</p>
 */
public class Documented {

    /**
     * Builds one with a name.
     *
     * @param name the name
     */
    public Documented(String name) {
    }

    /** Builds an anonymous one. */
    public Documented() {
    }

    /**
     * Adds two ints.
     *
     * @param a first
     * @param b second
     * @return the sum
     */
    public int add(int a, int b) {
        return a + b;
    }

    /** Adds three longs. */
    public long add(long a, long b, long c) {
        return a + b + c;
    }

    /** Joins the parts. */
    public String join(String... parts) {
        return String.join("", parts);
    }

    /** Picks one item. */
    public <T> T pick(List<T> items, int index) {
        return items.get(index);
    }

    public void undocumented() {
    }

    /** A nested type. */
    public static class Nested {

        /** Nested constructor. */
        public Nested(int[] values) {
        }
    }

    /** An inner type. */
    public class Inner {

        /** Inner constructor. */
        public Inner(String s) {
        }
    }
}
