package info.isaksson.erland.typeinspect.doc;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of {@link DocstringParser#parse(String)}. Immutable.
 */
public final class ParsedDocstring {

    public static final ParsedDocstring EMPTY = new ParsedDocstring("", "", List.of(), "", "");

    /** One documented parameter. Entries keep document order; names may repeat. */
    public static final class DocParam {
        public final String name;
        public final String description;

        public DocParam(String name, String description) {
            this.name = Objects.requireNonNullElse(name, "");
            this.description = Objects.requireNonNullElse(description, "");
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof DocParam)) return false;
            DocParam that = (DocParam) o;
            return name.equals(that.name) && description.equals(that.description);
        }

        @Override public int hashCode() {
            return Objects.hash(name, description);
        }

        @Override public String toString() {
            return "DocParam(" + name + ": " + description + ")";
        }
    }

    public final String shortDescription;
    public final String longDescription;
    public final List<DocParam> params;
    /** Description of the return value, empty when undocumented. */
    public final String returns;
    /** Docstring form of the comment (see {@link DocText#render}), capped in length. */
    public final String text;

    public ParsedDocstring(String shortDescription,
                           String longDescription,
                           List<DocParam> params,
                           String returns,
                           String text) {
        this.shortDescription = Objects.requireNonNullElse(shortDescription, "");
        this.longDescription = Objects.requireNonNullElse(longDescription, "");
        this.params = params == null ? List.of() : List.copyOf(params);
        this.returns = Objects.requireNonNullElse(returns, "");
        this.text = Objects.requireNonNullElse(text, "");
    }

    /** The short description, or the long one when there is no short one. */
    public String description() {
        return shortDescription.isEmpty() ? longDescription : shortDescription;
    }

    /** First entry for {@code name} with a non-empty description. */
    public Optional<DocParam> param(String name) {
        for (DocParam p : params) {
            if (p.name.equals(name) && !p.description.isEmpty()) return Optional.of(p);
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    @Override public String toString() {
        return "ParsedDocstring(short='" + shortDescription + "', params=" + params + ")";
    }
}
