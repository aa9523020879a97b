package info.isaksson.erland.typeinspect.error;

/** Thrown by {@code init} when the inspected class already holds an instance. */
public final class AlreadyInitializedException extends TypeInspectException {

    public AlreadyInitializedException(String message) {
        super(message);
    }
}
