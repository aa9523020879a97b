package info.isaksson.erland.typeinspect.doc;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.javadoc.Javadoc;
import com.github.javaparser.javadoc.JavadocBlockTag;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link DocstringParser} for Javadoc text, built on JavaParser's Javadoc model.
 *
 * <p>The short description is the first sentence of the main description (ending at a
 * {@code .}, {@code !} or {@code ?} followed by whitespace, or at the first blank line).
 * The long description is whatever follows it. {@code @param} tags give the parameter
 * descriptions and {@code @return} the return description.</p>
 */
public final class JavadocDocstringParser implements DocstringParser {

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?](?=\\s|$)");
    private static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n");

    @Override
    public ParsedDocstring parse(String raw) {
        if (raw == null || raw.isBlank()) return ParsedDocstring.EMPTY;

        // Tags are read from the whole comment; only the stored text is capped.
        Javadoc javadoc = StaticJavaParser.parseJavadoc(raw);
        String text = DocText.render(javadoc);
        if (text.isBlank()) return ParsedDocstring.EMPTY;

        String main = javadoc.getDescription().toText().trim();

        String[] split = splitFirstSentence(main);

        List<ParsedDocstring.DocParam> params = new ArrayList<>();
        String returns = "";
        for (JavadocBlockTag tag : javadoc.getBlockTags()) {
            if (tag.getType() == JavadocBlockTag.Type.PARAM) {
                String name = tag.getName().orElse("");
                if (name.isEmpty()) continue;
                params.add(new ParsedDocstring.DocParam(name, DocText.oneLine(tag.getContent().toText())));
            } else if (tag.getType() == JavadocBlockTag.Type.RETURN && returns.isEmpty()) {
                returns = DocText.oneLine(tag.getContent().toText());
            }
        }
        return new ParsedDocstring(split[0], split[1], params, returns, text);
    }

    /** {@code [firstSentence, rest]}; both trimmed, the first one on a single line. */
    static String[] splitFirstSentence(String description) {
        if (description == null || description.isBlank()) return new String[]{"", ""};
        String d = description.trim();

        int cut = d.length();
        Matcher para = BLANK_LINE.matcher(d);
        if (para.find()) cut = para.start();

        Matcher end = SENTENCE_END.matcher(d);
        if (end.find() && end.end() <= cut) cut = end.end();

        String first = DocText.oneLine(d.substring(0, cut));
        String rest = d.substring(cut).trim();
        return new String[]{first, rest};
    }
}
