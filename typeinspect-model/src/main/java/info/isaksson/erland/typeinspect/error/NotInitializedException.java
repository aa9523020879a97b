package info.isaksson.erland.typeinspect.error;

/** Thrown when an instance member is called before an instance exists. */
public final class NotInitializedException extends TypeInspectException {

    public NotInitializedException(String message) {
        super(message);
    }
}
