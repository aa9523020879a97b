package info.isaksson.erland.typeinspect.core;

import info.isaksson.erland.typeinspect.doc.AnnotationDocSource;
import info.isaksson.erland.typeinspect.doc.CompositeDocSource;
import info.isaksson.erland.typeinspect.doc.DocSource;
import info.isaksson.erland.typeinspect.doc.JavadocDocstringParser;
import info.isaksson.erland.typeinspect.doc.SourceJavadocSource;
import info.isaksson.erland.typeinspect.error.UnsupportedObjectException;
import info.isaksson.erland.typeinspect.extract.SignatureExtractor;
import info.isaksson.erland.typeinspect.model.Inspectable;
import info.isaksson.erland.typeinspect.model.Signature;

import java.lang.reflect.Executable;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point: inspect a callable, a class or an instance.
 *
 * <pre>{@code
 * TypeInspector inspector = new TypeInspector(options);
 * ClassMetadata meta = inspector.inspectClass(Greeter.class);
 * meta.init("Hello");
 * meta.callMethod("greet", "world");
 * }</pre>
 */
public final class TypeInspector {

    private final InspectOptions options;
    private final SignatureExtractor extractor;
    private final MemberFilter filter;

    public TypeInspector() {
        this(new InspectOptions());
    }

    public TypeInspector(InspectOptions options) {
        this.options = options == null ? new InspectOptions() : options.copy();
        this.extractor = new SignatureExtractor(docSourceFor(this.options), new JavadocDocstringParser(),
                this.options.skipReceiver, this.options.inferTypes);
        this.filter = MemberFilter.from(this.options);
    }

    /** A copy of the options this inspector was built with. */
    public InspectOptions options() {
        return options.copy();
    }

    /**
     * {@link Executable} gives a {@link Signature}; a {@link Class} gives a {@link ClassMetadata};
     * any other object gives the {@link ClassMetadata} of that instance.
     *
     * @throws UnsupportedObjectException for {@code null}, lambdas and primitive, array or annotation types
     */
    public Inspectable inspect(Object target) {
        if (target == null) throw new UnsupportedObjectException("Cannot inspect null");
        if (target instanceof Executable) return inspectCallable((Executable) target);
        if (target instanceof Class<?>) return inspectClass((Class<?>) target);
        return inspectInstance(target);
    }

    public Signature inspectCallable(Executable executable) {
        if (executable == null) throw new UnsupportedObjectException("Cannot inspect null");
        return extractor.extract(executable);
    }

    public ClassMetadata inspectClass(Class<?> type) {
        if (type == null) throw new UnsupportedObjectException("Cannot inspect null");
        requireSupported(type);
        return ClassMetadata.inspect(type, null, extractor, filter);
    }

    public ClassMetadata inspectInstance(Object instance) {
        if (instance == null) throw new UnsupportedObjectException("Cannot inspect null");
        requireSupported(instance.getClass());
        return ClassMetadata.inspect(null, instance, extractor, filter);
    }

    private static void requireSupported(Class<?> type) {
        if (type.isPrimitive() || type.isArray() || type.isAnnotation()) {
            throw new UnsupportedObjectException("Cannot inspect " + type.getTypeName());
        }
        if (type.isSynthetic() || type.isHidden()) {
            throw new UnsupportedObjectException("Cannot inspect lambda or generated class " + type.getName());
        }
    }

    static DocSource docSourceFor(InspectOptions options) {
        List<DocSource> sources = new ArrayList<>();
        if (options.useDocAnnotations) sources.add(new AnnotationDocSource());
        if (options.sourceRoots != null && !options.sourceRoots.isEmpty()) {
            sources.add(new SourceJavadocSource(options.sourceRoots));
        }
        if (sources.isEmpty()) return DocSource.none();
        return sources.size() == 1 ? sources.get(0) : new CompositeDocSource(sources);
    }

    @Override public String toString() {
        return "TypeInspector(skipReceiver=" + options.skipReceiver + ", sourceRoots=" + options.sourceRoots + ")";
    }
}
