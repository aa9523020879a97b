package info.isaksson.erland.typeinspect.doc;

import com.github.javaparser.javadoc.Javadoc;
import com.github.javaparser.javadoc.JavadocBlockTag;

import java.util.ArrayList;
import java.util.List;

/**
 * Text forms of parsed Javadoc.
 *
 * <p>Comment decoration ({@code *} margins, blank edges) is removed by JavaParser's Javadoc
 * parser; this class only decides how the parsed pieces are laid out and how long they may get.</p>
 */
public final class DocText {

    /** Max characters kept in a docstring. Longer text is cut and suffixed with "…(truncated)". */
    public static final int MAX_DOC_CHARS = 16 * 1024;

    static final String TRUNCATED_SUFFIX = "…(truncated)";

    private DocText() {}

    /**
     * Docstring form of a parsed Javadoc: the main description, then a blank line and one line
     * per block tag ({@code @param a the a}). Capped at {@link #MAX_DOC_CHARS}.
     */
    public static String render(Javadoc javadoc) {
        if (javadoc == null) return "";
        String description = javadoc.getDescription().toText().strip();
        List<String> tags = new ArrayList<>();
        for (JavadocBlockTag tag : javadoc.getBlockTags()) {
            tags.add(oneLine(tag.toText()));
        }

        StringBuilder sb = new StringBuilder(description);
        if (!tags.isEmpty()) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append(String.join("\n", tags));
        }
        return cap(sb.toString());
    }

    /** {@code text} unchanged if short enough, else cut so that text plus suffix is {@link #MAX_DOC_CHARS} long. */
    public static String cap(String text) {
        if (text == null) return "";
        if (text.length() <= MAX_DOC_CHARS) return text;
        return text.substring(0, MAX_DOC_CHARS - TRUNCATED_SUFFIX.length()) + TRUNCATED_SUFFIX;
    }

    /** Everything on one line with single spaces. */
    public static String oneLine(String text) {
        if (text == null) return "";
        return text.replaceAll("\\s+", " ").trim();
    }
}
