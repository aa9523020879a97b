package info.isaksson.erland.typeinspect.error;

/**
 * A reflective call could not be made, or the target threw a checked exception.
 *
 * <p>Unchecked exceptions thrown by the target are rethrown unchanged instead.</p>
 */
public final class MemberInvocationException extends TypeInspectException {

    public MemberInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
