package info.isaksson.erland.typeinspect.doc;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Asks each delegate in turn; the first non-blank answer wins. */
public final class CompositeDocSource implements DocSource {

    private final List<DocSource> delegates;

    public CompositeDocSource(List<DocSource> delegates) {
        this.delegates = delegates == null ? List.of() : List.copyOf(delegates);
    }

    @Override
    public Optional<String> rawDoc(AnnotatedElement element) {
        for (DocSource d : delegates) {
            Optional<String> found = d.rawDoc(element);
            if (found.isPresent() && !found.get().isBlank()) return found;
        }
        return Optional.empty();
    }

    @Override
    public List<String> problems() {
        List<String> out = new ArrayList<>();
        for (DocSource d : delegates) out.addAll(d.problems());
        return out;
    }
}
