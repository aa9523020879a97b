package info.isaksson.erland.typeinspect.core;

import java.lang.reflect.Executable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Collects warnings while a {@link ClassMetadata} is built.
 *
 * <p>The final list is ordered by code, then member name (type-level warnings first), then
 * message, so the same type always yields the same list.</p>
 */
final class InspectWarnings {

    private static final Comparator<InspectWarning> ORDER = Comparator
            .comparing((InspectWarning w) -> w.code)
            .thenComparing(w -> w.member, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(w -> w.message);

    private final List<InspectWarning> warnings = new ArrayList<>();

    void overloadsDropped(String member, Executable kept, List<? extends Executable> dropped) {
        for (Executable d : dropped) warnings.add(InspectWarning.overloadDropped(member, kept, d));
    }

    void docSourceErrors(List<String> problems) {
        for (String p : problems) warnings.add(InspectWarning.docSourceError(p));
    }

    List<InspectWarning> toDeterministicList() {
        List<InspectWarning> out = new ArrayList<>(warnings);
        out.sort(ORDER);
        return Collections.unmodifiableList(out);
    }
}
