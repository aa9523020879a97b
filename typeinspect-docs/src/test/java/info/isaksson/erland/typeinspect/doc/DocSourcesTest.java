package info.isaksson.erland.typeinspect.doc;

import info.isaksson.erland.typeinspect.doc.fixture.Annotated;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DocSourcesTest {

    @Test
    void annotationSource_readsDoc() throws Exception {
        AnnotationDocSource source = new AnnotationDocSource();
        assertEquals("From the annotation.", source.rawDoc(Annotated.class).orElseThrow());
        assertTrue(source.rawDoc(Annotated.class.getMethod("plain")).isEmpty());

        ParsedDocstring run = new JavadocDocstringParser().parse(
                source.rawDoc(Annotated.class.getMethod("run", int.class)).orElseThrow());
        assertEquals("Runs it.", run.shortDescription);
        assertEquals("how often", run.param("times").orElseThrow().description);
    }

    @Test
    void composite_firstNonBlankAnswerWins() throws Exception {
        DocSource blank = element -> java.util.Optional.of("  ");
        DocSource javadoc = new SourceJavadocSource(List.of(Path.of("src", "test", "java")));
        CompositeDocSource composite = new CompositeDocSource(List.of(blank, new AnnotationDocSource(), javadoc));

        assertEquals("From the annotation.", composite.rawDoc(Annotated.class).orElseThrow());
        assertTrue(composite.rawDoc(Annotated.class.getMethod("plain")).isEmpty());

        CompositeDocSource sourceFirst = new CompositeDocSource(List.of(javadoc, new AnnotationDocSource()));
        assertEquals(" Javadoc of the annotated fixture. ", sourceFirst.rawDoc(Annotated.class).orElseThrow());
    }

    @Test
    void none_findsNothing() {
        assertTrue(DocSource.none().rawDoc(Annotated.class).isEmpty());
        assertTrue(new CompositeDocSource(null).rawDoc(Annotated.class).isEmpty());
    }
}
