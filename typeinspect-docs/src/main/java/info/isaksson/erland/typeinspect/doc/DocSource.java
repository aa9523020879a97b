package info.isaksson.erland.typeinspect.doc;

import java.lang.reflect.AnnotatedElement;
import java.util.List;
import java.util.Optional;

/**
 * Where raw documentation text for a class, method or constructor comes from.
 */
public interface DocSource {

    /** Raw (unparsed) documentation of {@code element}, or empty when it has none. */
    Optional<String> rawDoc(AnnotatedElement element);

    /** Problems met so far (unreadable files and the like), oldest first. */
    default List<String> problems() {
        return List.of();
    }

    /** A source that never finds anything. */
    static DocSource none() {
        return element -> Optional.empty();
    }
}
