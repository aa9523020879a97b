package info.isaksson.erland.typeinspect.error;

/** Lookup by name found nothing. */
public final class NotFoundException extends TypeInspectException {

    public final String key;

    public NotFoundException(String what, String key) {
        super(what + " not found: '" + key + "'");
        this.key = key;
    }
}
