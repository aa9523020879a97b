package info.isaksson.erland.typeinspect.taxonomy;

import info.isaksson.erland.typeinspect.model.TypeDescriptor;
import info.isaksson.erland.typeinspect.model.TypeDescriptorKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static info.isaksson.erland.typeinspect.taxonomy.Samples.param;
import static org.junit.jupiter.api.Assertions.*;

public class TypeTaxonomyTest {

    @Test
    void literalOrNull_containsLiteral_butIsNotDirectLiteral() {
        TypeDescriptor t = TypeReader.read(param("literalOrNull", 0));

        assertTrue(TypeTaxonomy.isUnion(t));
        assertTrue(TypeTaxonomy.isOrContainsLiteral(t));
        assertFalse(TypeTaxonomy.isDirectLiteral(t));
        assertEquals(Optional.of(List.of("a", "b")), TypeTaxonomy.getChoices(t));
        assertEquals(List.of("a", "b"), TypeTaxonomy.literalChoices(t));
    }

    @Test
    void getChoices_concatenatesLiteralAndEnumBranches_firstSeenWithoutDuplicates() {
        TypeDescriptor t = TypeReader.read(param("literalAndEnum", 0));

        assertEquals(3, TypeTaxonomy.unionBranches(t).size());
        assertEquals(List.of("x", "RED", "GREEN", "BLUE"), TypeTaxonomy.getChoices(t).orElseThrow());
    }

    @Test
    void getChoices_unionWithoutLiteralOrEnum_isEmpty_andPlainHasNone() {
        TypeDescriptor union = TypeReader.read(param("noChoices", 0));
        assertEquals(Optional.of(List.of()), TypeTaxonomy.getChoices(union));

        assertEquals(Optional.empty(), TypeTaxonomy.getChoices(TypeDescriptor.plain(String.class)));
        assertEquals(Optional.empty(), TypeTaxonomy.getChoices(TypeDescriptor.unset()));
    }

    @Test
    void getChoices_enum_returnsConstantNames() {
        TypeDescriptor t = TypeReader.read(Samples.Color.class);
        assertTrue(TypeTaxonomy.isEnum(t));
        assertEquals(List.of("RED", "GREEN", "BLUE"), TypeTaxonomy.getChoices(t).orElseThrow());
    }

    @Test
    void bareLiteralMarker_isNotADirectLiteral() {
        TypeDescriptor t = TypeReader.read(param("bareLiteral", 0));

        assertEquals(TypeDescriptorKind.LITERAL, t.kind);
        assertFalse(TypeTaxonomy.isDirectLiteral(t));
        assertFalse(TypeTaxonomy.isOrContainsLiteral(t));
        assertEquals(Optional.empty(), TypeTaxonomy.getChoices(t));
        assertThrows(IllegalArgumentException.class, () -> TypeTaxonomy.literalContains(t, "x"));
    }

    @Test
    void flattenUnion_isIdempotent() {
        TypeDescriptor inner = TypeDescriptor.union(
                TypeDescriptor.plain(String.class),
                TypeDescriptor.union(TypeDescriptor.plain(Integer.class), TypeDescriptor.nullType()));
        TypeDescriptor outer = TypeDescriptor.union(inner, TypeDescriptor.plain(String.class));

        TypeDescriptor once = TypeTaxonomy.flattenUnion(outer);
        TypeDescriptor twice = TypeTaxonomy.flattenUnion(once);

        assertEquals(once, twice);
        assertEquals(3, once.args.size());
        for (TypeDescriptor branch : once.args) {
            assertFalse(TypeTaxonomy.isUnion(branch));
        }
        assertEquals("String | Integer | null", TypeTaxonomy.renderName(once));
    }

    @Test
    void flattenUnion_leavesNonUnionsAlone() {
        TypeDescriptor plain = TypeDescriptor.plain(Long.class);
        assertSame(plain, TypeTaxonomy.flattenUnion(plain));
        assertEquals(List.of(), TypeTaxonomy.unionBranches(plain));
    }

    @Test
    void simplify_collapsesGenericsToOrigin_andUnionBranches() {
        TypeDescriptor rows = TypeReader.read(param("generic", 0));
        assertTrue(TypeTaxonomy.isGenericContainer(rows));
        assertEquals(TypeDescriptor.plain(List.class), TypeTaxonomy.simplify(rows));

        TypeDescriptor union = TypeDescriptor.union(TypeDescriptor.plain(Double.class), rows);
        TypeDescriptor simplified = TypeTaxonomy.simplify(union);
        assertEquals(List.of(TypeDescriptor.plain(Double.class), TypeDescriptor.plain(List.class)), simplified.args);

        TypeDescriptor plain = TypeDescriptor.plain(String.class);
        assertSame(plain, TypeTaxonomy.simplify(plain));
    }

    @Test
    void renderName_stripsQualification() {
        assertEquals("List<Map<String, Integer>>", TypeTaxonomy.renderName(TypeReader.read(param("generic", 0))));
        assertEquals("List<? extends Number>", TypeTaxonomy.renderName(TypeReader.read(param("wildcard", 0))));
        assertEquals("T", TypeTaxonomy.renderName(TypeReader.read(param("typeVar", 0))));
        assertEquals("String[]", TypeTaxonomy.renderName(TypeReader.read(param("array", 0))));
        assertEquals("Color | null", TypeTaxonomy.renderName(TypeReader.read(param("nullableEnum", 0))));
        assertEquals("Literal[\"a\", \"b\"] | null", TypeTaxonomy.renderName(TypeReader.read(param("literalOrNull", 0))));
        assertEquals("Unset", TypeTaxonomy.renderName(TypeDescriptor.unset()));
    }

    @Test
    void renderSimplified_marksNullableUnions() {
        assertEquals("Color?", TypeTaxonomy.renderSimplified(TypeReader.read(param("nullableEnum", 0))));
        assertEquals("(String | Integer)?", TypeTaxonomy.renderSimplified(TypeReader.read(param("nestedNullable", 0))));
        assertEquals("String | Integer", TypeTaxonomy.renderSimplified(TypeReader.read(param("noChoices", 0))));
    }

    @Test
    void literalContains_checksValues() {
        TypeDescriptor t = TypeReader.read(param("intLiteral", 0));
        assertTrue(TypeTaxonomy.literalContains(t, 2));
        assertFalse(TypeTaxonomy.literalContains(t, 3));
        assertThrows(IllegalArgumentException.class,
                () -> TypeTaxonomy.literalContains(TypeDescriptor.plain(String.class), "a"));
    }

    @Test
    void iterableAndMapping_followTheRawType() {
        assertTrue(TypeTaxonomy.isIterable(TypeDescriptor.plain(ArrayList.class)));
        assertTrue(TypeTaxonomy.isIterable(TypeDescriptor.plain(int[].class)));
        assertTrue(TypeTaxonomy.isIterable(TypeReader.read(param("generic", 0))));
        assertTrue(TypeTaxonomy.isIterable(TypeDescriptor.plain(HashMap.class)));
        assertFalse(TypeTaxonomy.isIterable(TypeDescriptor.plain(String.class)));

        assertTrue(TypeTaxonomy.isMapping(TypeDescriptor.plain(Map.class)));
        assertFalse(TypeTaxonomy.isMapping(TypeDescriptor.plain(List.class)));
        assertFalse(TypeTaxonomy.isMapping(TypeDescriptor.unset()));
    }

    @Test
    void describeValueType_usesTheRuntimeClass() {
        assertEquals(TypeDescriptor.plain(Integer.class), TypeTaxonomy.describeValueType(4));
        assertTrue(TypeTaxonomy.describeValueType(null).isNullType());
        assertEquals("ArrayList", TypeTaxonomy.renderName(TypeTaxonomy.describeValueType(new ArrayList<String>())));
    }
}
