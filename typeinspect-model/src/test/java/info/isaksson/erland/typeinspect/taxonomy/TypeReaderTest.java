package info.isaksson.erland.typeinspect.taxonomy;

import info.isaksson.erland.typeinspect.model.TypeDescriptor;
import info.isaksson.erland.typeinspect.model.TypeDescriptorKind;
import info.isaksson.erland.typeinspect.model.Unset;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static info.isaksson.erland.typeinspect.taxonomy.Samples.param;
import static org.junit.jupiter.api.Assertions.*;

public class TypeReaderTest {

    @Test
    void parameterizedType_becomesGenericWithArguments() {
        TypeDescriptor t = TypeReader.read(param("generic", 0));

        assertEquals(TypeDescriptorKind.GENERIC, t.kind);
        assertEquals(List.class, t.rawType);
        assertEquals(1, t.args.size());
        TypeDescriptor map = t.args.get(0);
        assertEquals(Map.class, map.rawType);
        assertEquals(List.of(TypeDescriptor.plain(String.class), TypeDescriptor.plain(Integer.class)), map.args);
    }

    @Test
    void nullableOneOf_isFlattenedIntoOneUnion() {
        TypeDescriptor t = TypeReader.read(param("nestedNullable", 0));

        assertEquals(List.of(
                TypeDescriptor.plain(String.class),
                TypeDescriptor.plain(Integer.class),
                TypeDescriptor.nullType()), t.args);
    }

    @Test
    void isNullable_matchesAnyAnnotationNamedNullable() {
        assertTrue(TypeReader.isNullable(param("nestedNullable", 0)));
        assertTrue(TypeReader.isNullable(param("nullableEnum", 0)));
        assertFalse(TypeReader.isNullable(param("noChoices", 0)));
        assertFalse(TypeReader.isNullable(param("array", 0)));
    }

    @Test
    void singleBranchUnion_isCollapsed() {
        TypeDescriptor t = TypeReader.read(param("singleBranch", 0));
        assertFalse(TypeTaxonomy.isUnion(t));
        assertEquals(TypeDescriptor.plain(String.class), t);
    }

    @Test
    void literalValues_areConvertedToTheBaseType_andDeduplicated() {
        TypeDescriptor t = TypeReader.read(param("intLiteral", 0));
        assertEquals(List.of(1, 2), t.values);
        assertEquals(int.class, t.rawType);
    }

    @Test
    void invalidLiteralValue_isRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> TypeReader.read(param("badIntLiteral", 0)));
        assertTrue(ex.getMessage().contains("one"));
    }

    @Test
    void valueType_usesDeclaringEnumForConstantBodies() {
        assertEquals(TypeReader.read(Samples.Op.class), TypeReader.valueType(Samples.Op.ADD));
        assertEquals(TypeDescriptorKind.ENUM, TypeReader.valueType(Samples.Op.ADD).kind);
    }

    @Test
    void valueType_distinguishesNullFromUnset() {
        assertTrue(TypeReader.valueType(null).isNullType());
        assertTrue(TypeReader.valueType(Unset.INSTANCE).isUnset());
        assertEquals(TypeDescriptor.plain(Integer.class), TypeReader.valueType(4));
    }

    @Test
    void convertLiteral_handlesCharsAndBooleans() {
        assertEquals('x', TypeReader.convertLiteral(char.class, "x"));
        assertEquals(Boolean.TRUE, TypeReader.convertLiteral(Boolean.class, "true"));
        assertThrows(IllegalArgumentException.class, () -> TypeReader.convertLiteral(boolean.class, "yes"));
        assertEquals("free text", TypeReader.convertLiteral(null, "free text"));
    }
}
