package info.isaksson.erland.typeinspect.error;

/** The object is neither an introspectable callable nor a constructible type. */
public final class UnsupportedObjectException extends TypeInspectException {

    public UnsupportedObjectException(String message) {
        super(message);
    }
}
