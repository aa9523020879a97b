package info.isaksson.erland.typeinspect.error;

/** A selector that is neither a name nor an integral index. */
public final class InvalidKeyTypeException extends TypeInspectException {

    public InvalidKeyTypeException(Object key) {
        super("Selector must be a String name or an integral index, got "
                + (key == null ? "null" : key.getClass().getName()));
    }
}
