package info.isaksson.erland.typeinspect.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeDescriptorTest {

    enum Size { S, M, L }

    @Test
    void union_flattensNestedBranches_andDropsDuplicates() {
        TypeDescriptor s = TypeDescriptor.plain(String.class);
        TypeDescriptor i = TypeDescriptor.plain(Integer.class);
        TypeDescriptor t = TypeDescriptor.union(s, TypeDescriptor.union(i, s), TypeDescriptor.nullType());

        assertEquals(TypeDescriptorKind.UNION, t.kind);
        assertEquals(List.of(s, i, TypeDescriptor.nullType()), t.args);
    }

    @Test
    void nullType_isDistinctFromUnset() {
        assertNotEquals(TypeDescriptor.unset(), TypeDescriptor.nullType());
        assertTrue(TypeDescriptor.nullType().isNullType());
        assertFalse(TypeDescriptor.nullType().isUnset());
        assertTrue(TypeDescriptor.unset().isUnset());
        assertFalse(TypeDescriptor.plain("null").isUnset());
    }

    @Test
    void enumType_listsConstantNamesInDeclarationOrder() {
        TypeDescriptor t = TypeDescriptor.enumType(Size.class);
        assertEquals(List.of("S", "M", "L"), t.choices);
        assertEquals(Size.class, t.rawType);
    }

    @Test
    void literal_allowsNullValues_andIsImmutable() {
        TypeDescriptor t = TypeDescriptor.literal(null, Arrays.asList("a", null));
        assertEquals(2, t.values.size());
        assertNull(t.values.get(1));
        assertThrows(UnsupportedOperationException.class, () -> t.values.add("b"));
    }

    @Test
    void equality_ignoresHowTheDescriptorWasBuilt() {
        assertEquals(TypeDescriptor.plain(String.class), TypeDescriptor.plain(String.class));
        assertEquals(
                TypeDescriptor.generic(List.class, List.of(TypeDescriptor.plain(String.class))).hashCode(),
                TypeDescriptor.generic(List.class, List.of(TypeDescriptor.plain(String.class))).hashCode());
        assertNotEquals(TypeDescriptor.plain(List.class),
                TypeDescriptor.generic(List.class, List.of()));
    }
}
