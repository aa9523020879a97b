package info.isaksson.erland.typeinspect.model;

import info.isaksson.erland.typeinspect.error.IndexOutOfRangeException;
import info.isaksson.erland.typeinspect.error.InvalidKeyTypeException;
import info.isaksson.erland.typeinspect.error.NotFoundException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SignatureTest {

    private static Signature sample() {
        return new Signature("f", List.of(
                new Parameter("a", ParameterKind.POSITIONAL_OR_KEYWORD),
                new Parameter("b", ParameterKind.POSITIONAL_OR_KEYWORD, null, null, "Argument b"),
                new Parameter("c", ParameterKind.POSITIONAL_OR_KEYWORD, TypeDescriptor.plain(int.class), 4, null),
                new Parameter("rest", ParameterKind.VAR_POSITIONAL, TypeDescriptor.plain(String.class), Unset.INSTANCE, null)
        ), TypeDescriptor.plain(int.class), "Does f.", "Does f.");
    }

    @Test
    void lookup_byNameIndexAndKey() {
        Signature s = sample();
        assertEquals("a", s.getParam(0).name);
        assertEquals("c", s.getParam("c").name);
        assertEquals("b", s.getParam((Object) "b").name);
        assertEquals("b", s.getParam(Integer.valueOf(1)).name);
        assertEquals(List.of("a", "b", "c", "rest"), s.parameterNames());
    }

    @Test
    void lookup_failures() {
        Signature s = sample();
        assertThrows(NotFoundException.class, () -> s.getParam("missing"));
        assertThrows(IndexOutOfRangeException.class, () -> s.getParam(4));
        assertThrows(IndexOutOfRangeException.class, () -> s.getParam(-1));
        assertThrows(InvalidKeyTypeException.class, () -> s.getParam(2.5));
        assertThrows(InvalidKeyTypeException.class, () -> s.getParam(Float.valueOf(1)));
        assertThrows(IndexOutOfRangeException.class, () -> s.getParam(Long.valueOf(Integer.MAX_VALUE + 1L)));
        assertThrows(IndexOutOfRangeException.class, () -> s.getParam(BigInteger.TEN.pow(30)));
    }

    @Test
    void lookup_acceptsAnyIntegralIndex() {
        Signature s = sample();
        assertEquals("b", s.getParam(Long.valueOf(1)).name);
        assertEquals("c", s.getParam(Short.valueOf((short) 2)).name);
        assertEquals("a", s.getParam(Byte.valueOf((byte) 0)).name);
        assertEquals("rest", s.getParam(BigInteger.valueOf(3)).name);
    }

    @Test
    void duplicateParameterNames_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Signature("g", List.of(
                new Parameter("x", ParameterKind.POSITIONAL_OR_KEYWORD),
                new Parameter("x", ParameterKind.KEYWORD_ONLY)), null, null, null));
    }

    @Test
    void bind_ordersArguments_andFillsDefaults() {
        Map<String, Object> named = new LinkedHashMap<>();
        named.put("b", "bee");
        named.put("a", 1);

        assertEquals(List.of(1, "bee", 4), sample().bind(named));
    }

    @Test
    void bind_rejectsMissingRequiredAndUnknownNames() {
        assertThrows(IllegalArgumentException.class, () -> sample().bind(Map.of("b", 2)));
        assertThrows(IllegalArgumentException.class, () -> sample().bind(Map.of("a", 1, "zzz", 2)));
    }

    @Test
    void render_andData() {
        Signature s = sample();
        assertEquals("f(a, b: null = null, c: int = 4, rest: String) -> int", s.render());

        Map<String, Object> data = s.toData();
        assertEquals("f", data.get("name"));
        assertEquals("int", data.get("returnType"));
        assertEquals(4, ((List<?>) data.get("parameters")).size());
        assertTrue(s.hasDocstring());
    }
}
