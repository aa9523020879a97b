package info.isaksson.erland.typeinspect.doc;

import info.isaksson.erland.typeinspect.annotations.Doc;

import java.lang.reflect.AnnotatedElement;
import java.util.Optional;

/** Reads the runtime {@link Doc} annotation. */
public final class AnnotationDocSource implements DocSource {

    @Override
    public Optional<String> rawDoc(AnnotatedElement element) {
        if (element == null) return Optional.empty();
        Doc doc = element.getAnnotation(Doc.class);
        if (doc == null || doc.value().isBlank()) return Optional.empty();
        return Optional.of(doc.value());
    }
}
