package info.isaksson.erland.typeinspect.error;

/**
 * Base class for failures raised while looking up or invoking inspected members.
 */
public abstract class TypeInspectException extends RuntimeException {

    protected TypeInspectException(String message) {
        super(message);
    }

    protected TypeInspectException(String message, Throwable cause) {
        super(message, cause);
    }
}
