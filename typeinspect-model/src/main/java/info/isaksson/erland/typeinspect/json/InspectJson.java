package info.isaksson.erland.typeinspect.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import info.isaksson.erland.typeinspect.model.Inspectable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * JSON form of the {@link Inspectable#toData()} projection.
 *
 * <p>Output is deterministic: map keys are sorted, lists keep their order.</p>
 */
public final class InspectJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private InspectJson() {}

    public static String toJsonString(Inspectable inspected) throws IOException {
        if (inspected == null) throw new IllegalArgumentException("inspected is null");
        return MAPPER.writer(PRETTY).writeValueAsString(inspected.toData()) + "\n";
    }

    public static void write(Inspectable inspected, Path path) throws IOException {
        if (inspected == null) throw new IllegalArgumentException("inspected is null");
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, inspected.toData());
            out.write('\n');
        }
    }

    /** Read a projection back as plain maps and lists. */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> readData(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, Map.class);
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
