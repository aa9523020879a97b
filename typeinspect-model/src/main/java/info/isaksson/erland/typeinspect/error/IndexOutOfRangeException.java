package info.isaksson.erland.typeinspect.error;

/** Positional lookup outside {@code [0, size)}. */
public final class IndexOutOfRangeException extends TypeInspectException {

    public final long index;
    public final int size;

    public IndexOutOfRangeException(String what, long index, int size) {
        super(what + " index " + index + " out of range (size " + size + ")");
        this.index = index;
        this.size = size;
    }
}
