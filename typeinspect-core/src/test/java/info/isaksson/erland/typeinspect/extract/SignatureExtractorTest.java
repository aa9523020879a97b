package info.isaksson.erland.typeinspect.extract;

import info.isaksson.erland.typeinspect.doc.AnnotationDocSource;
import info.isaksson.erland.typeinspect.doc.JavadocDocstringParser;
import info.isaksson.erland.typeinspect.doc.ParsedDocstring;
import info.isaksson.erland.typeinspect.doc.SourceJavadocSource;
import info.isaksson.erland.typeinspect.error.IndexOutOfRangeException;
import info.isaksson.erland.typeinspect.error.InvalidKeyTypeException;
import info.isaksson.erland.typeinspect.error.NotFoundException;
import info.isaksson.erland.typeinspect.examples.Examples;
import info.isaksson.erland.typeinspect.examples.Examples.Functions;
import info.isaksson.erland.typeinspect.model.Member;
import info.isaksson.erland.typeinspect.model.Parameter;
import info.isaksson.erland.typeinspect.model.ParameterKind;
import info.isaksson.erland.typeinspect.model.Signature;
import info.isaksson.erland.typeinspect.model.TypeDescriptor;
import info.isaksson.erland.typeinspect.model.TypeDescriptorKind;
import info.isaksson.erland.typeinspect.model.Unset;
import info.isaksson.erland.typeinspect.taxonomy.TypeTaxonomy;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SignatureExtractorTest {

    private static final Path TEST_SOURCES = Path.of("src", "test", "java");

    private final SignatureExtractor extractor = new SignatureExtractor(
            new SourceJavadocSource(List.of(TEST_SOURCES)), new JavadocDocstringParser(), true, true);

    private static Method fn(String name, Class<?>... params) throws NoSuchMethodException {
        return Functions.class.getMethod(name, params);
    }

    @Test
    void untypedNullAndIntParameters_withDescriptionsFromJavadoc() throws Exception {
        Signature f = extractor.extract(fn("f", Object.class, Object.class, int.class));

        assertEquals("f", f.name);
        assertTrue(f.getParam("a").type.isUnset());
        assertTrue(f.getParam("b").type.isNullType());
        assertEquals(TypeDescriptor.plain(int.class), f.getParam("c").type);

        assertEquals("Argument a", f.getParam("a").description);
        assertEquals("Argument b", f.getParam("b").description);
        assertEquals("Argument c", f.getParam("c").description);

        assertSame(Unset.INSTANCE, f.getParam("a").defaultValue);
        assertNull(f.getParam("b").defaultValue);
        assertEquals(4, f.getParam("c").defaultValue);
        assertEquals("Computes f.", f.description);
        assertEquals(TypeDescriptor.plain(int.class), f.returnType);
    }

    @Test
    void untypedDefaults_takeTheDefaultsRuntimeType() throws Exception {
        Signature s = extractor.extract(fn("inferred", Object.class, Object.class, Examples.Color.class));

        assertEquals(TypeDescriptor.plain(Integer.class), s.getParam("c").type);
        assertEquals(TypeDescriptor.plain(String.class), s.getParam("s").type);
        assertEquals("x", s.getParam("s").defaultValue);
        assertEquals(Examples.Color.RED, s.getParam("color").defaultValue);
        assertTrue(TypeTaxonomy.isEnum(s.getParam("color").type));
    }

    @Test
    void inferenceOff_keepsUntypedDefaultsUntyped() throws Exception {
        SignatureExtractor plain = new SignatureExtractor(null, null, true, false);
        Signature s = plain.extract(fn("inferred", Object.class, Object.class, Examples.Color.class));

        assertTrue(s.getParam("c").type.isUnset());
        assertTrue(s.getParam("c").hasDefault());
    }

    @Test
    void varargs_areVarPositional_typedByComponent() throws Exception {
        Signature join = extractor.extract(fn("join", String.class, String[].class));

        assertEquals(ParameterKind.POSITIONAL_OR_KEYWORD, join.getParam(0).kind);
        Parameter parts = join.getParam("parts");
        assertEquals(ParameterKind.VAR_POSITIONAL, parts.kind);
        assertEquals(TypeDescriptor.plain(String.class), parts.type);
        assertTrue(parts.isRequired());
    }

    @Test
    void returnTypes_objectIsUntyped_voidIsPlain_constructorsHaveNone() throws Exception {
        assertTrue(extractor.extract(fn("untypedReturn")).returnType.isUnset());
        assertEquals(TypeDescriptor.plain(void.class),
                extractor.extract(fn("inferred", Object.class, Object.class, Examples.Color.class)).returnType);

        Signature init = extractor.extract(Examples.ExampleClass1.class.getConstructor(String.class, int.class));
        assertEquals(Member.INIT_NAME, init.name);
        assertTrue(init.returnType.isUnset());
        assertEquals("Builds the example.", init.description);
        assertEquals("the text part", init.getParam("a").description);
    }

    @Test
    void typeUseAnnotations_giveUnionsAndLiterals() throws Exception {
        Signature choice = extractor.extract(fn("choice", String.class));

        TypeDescriptor mode = choice.getParam("mode").type;
        assertEquals(TypeDescriptorKind.UNION, mode.kind);
        assertTrue(TypeTaxonomy.isOrContainsLiteral(mode));
        assertEquals(List.of("a", "b"), TypeTaxonomy.getChoices(mode).orElseThrow());
        assertEquals("String | Integer", TypeTaxonomy.renderName(choice.returnType));

        Signature maybe = extractor.extract(fn("maybe", Object.class));
        assertEquals("Object?", TypeTaxonomy.renderSimplified(maybe.getParam("value").type));
        assertEquals("Object?", TypeTaxonomy.renderSimplified(maybe.returnType));
    }

    @Test
    void genericTypes_areGenericContainers() throws Exception {
        Signature names = extractor.extract(fn("names", Map.class));

        assertTrue(TypeTaxonomy.isGenericContainer(names.getParam("counts").type));
        assertTrue(TypeTaxonomy.isMapping(names.getParam("counts").type));
        assertEquals("List<String>", TypeTaxonomy.renderName(names.returnType));
    }

    @Test
    void innerClassConstructor_listsOnlyTheDeclaredParameters() throws Exception {
        Constructor<?> c = Examples.Outer.Inner.class.getConstructor(Examples.Outer.class, String.class, int.class);

        Signature s = extractor.extract(c);
        assertEquals(Member.INIT_NAME, s.name);
        assertEquals(List.of("a", "b"), s.parameterNames());
        assertEquals(TypeDescriptor.plain(String.class), s.getParam("a").type);
        assertEquals("the number", s.getParam("b").description);
        assertEquals("Inner part.", s.description);
        assertEquals(2, SignatureExtractor.declaredParameters(c).size());
    }

    @Test
    void receiver_isAddedWhenNotSkipped() throws Exception {
        SignatureExtractor withReceiver = new SignatureExtractor(null, null, false, true);
        Method m = Examples.ExampleClassA.class.getMethod("method2");

        Signature s = withReceiver.extract(m);
        assertEquals(1, s.parameters.size());
        assertEquals(SignatureExtractor.RECEIVER_NAME, s.getParam(0).name);
        assertEquals(ParameterKind.POSITIONAL_ONLY, s.getParam(0).kind);
        assertEquals(TypeDescriptor.plain(Examples.ExampleClassA.class), s.getParam(0).type);

        assertTrue(withReceiver.extract(Examples.ExampleClassC.class.getMethod("staticMethod")).parameters.isEmpty());
        assertTrue(extractor.extract(m).parameters.isEmpty());
    }

    @Test
    void docAnnotation_isUsedWhenConfigured() throws Exception {
        SignatureExtractor annotated = new SignatureExtractor(new AnnotationDocSource(), null, true, true);
        Signature s = annotated.extract(fn("annotated", int.class));

        assertEquals("Annotated function.", s.description);
        assertEquals("the x", s.getParam("x").description);
        assertTrue(s.hasDocstring());
    }

    @Test
    void noDocumentation_leavesDescriptionsEmpty() throws Exception {
        Signature s = new SignatureExtractor().extract(fn("f", Object.class, Object.class, int.class));

        assertEquals("", s.description);
        assertFalse(s.hasDocstring());
        assertNull(s.getParam("a").description);
    }

    @Test
    void badDefaults_areRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> extractor.extract(Examples.BadDefaults.class.getMethod("notAnInt", int.class)));
        assertThrows(IllegalArgumentException.class,
                () -> extractor.extract(Examples.BadDefaults.class.getMethod("nullForPrimitive", int.class)));
    }

    @Test
    void mergeDescriptions_returnsANewList_andLeavesTheInputAlone() {
        List<Parameter> params = List.of(
                new Parameter("a", ParameterKind.POSITIONAL_OR_KEYWORD),
                new Parameter("b", ParameterKind.POSITIONAL_OR_KEYWORD));
        ParsedDocstring doc = new JavadocDocstringParser().parse("Doc.\n@param b about b\n@param zzz unknown");

        List<Parameter> merged = SignatureExtractor.mergeDescriptions(params, doc);

        assertNull(params.get(1).description);
        assertNull(merged.get(0).description);
        assertEquals("about b", merged.get(1).description);
        assertSame(params.get(0), merged.get(0));
    }

    @Test
    void lookupErrors_onExtractedSignatures() throws Exception {
        Signature f = extractor.extract(fn("f", Object.class, Object.class, int.class));
        assertThrows(NotFoundException.class, () -> f.getParam("zzz"));
        assertThrows(IndexOutOfRangeException.class, () -> f.getParam(3));
        assertThrows(InvalidKeyTypeException.class, () -> f.getParam(1.5));
    }
}
