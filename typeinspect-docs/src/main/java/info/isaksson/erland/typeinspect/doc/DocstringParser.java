package info.isaksson.erland.typeinspect.doc;

/**
 * Parses raw documentation text into a short description, a long description and
 * per-parameter descriptions.
 */
public interface DocstringParser {

    /** Null, empty or blank input gives {@link ParsedDocstring#EMPTY}. Never throws on malformed text. */
    ParsedDocstring parse(String raw);
}
