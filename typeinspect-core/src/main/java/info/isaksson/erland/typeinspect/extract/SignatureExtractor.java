package info.isaksson.erland.typeinspect.extract;

import info.isaksson.erland.typeinspect.annotations.Default;
import info.isaksson.erland.typeinspect.annotations.Literal;
import info.isaksson.erland.typeinspect.annotations.OneOf;
import info.isaksson.erland.typeinspect.doc.DocSource;
import info.isaksson.erland.typeinspect.doc.DocstringParser;
import info.isaksson.erland.typeinspect.doc.JavadocDocstringParser;
import info.isaksson.erland.typeinspect.doc.ParsedDocstring;
import info.isaksson.erland.typeinspect.model.Member;
import info.isaksson.erland.typeinspect.model.Parameter;
import info.isaksson.erland.typeinspect.model.ParameterKind;
import info.isaksson.erland.typeinspect.model.Signature;
import info.isaksson.erland.typeinspect.model.TypeDescriptor;
import info.isaksson.erland.typeinspect.model.Unset;
import info.isaksson.erland.typeinspect.taxonomy.TypeReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.AnnotatedArrayType;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.AnnotatedType;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Signature} from a {@link Method} or {@link Constructor}.
 *
 * <ol>
 *   <li>parameters in declaration order: name, kind, declared type ({@code Object} without a
 *       taxonomy annotation counts as untyped) and the {@link Default} value</li>
 *   <li>the receiver ({@code this}), unless skipped</li>
 *   <li>documentation from the {@link DocSource}, parsed by the {@link DocstringParser} and folded
 *       into a new parameter list by name</li>
 *   <li>the return type: {@code Object} is untyped, constructors have none</li>
 * </ol>
 *
 * <p>Extraction either returns a complete signature or throws; nothing is cached.</p>
 */
public final class SignatureExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(SignatureExtractor.class);

    /** Name of the receiver parameter when it is not skipped. */
    public static final String RECEIVER_NAME = "this";

    private final DocSource docs;
    private final DocstringParser parser;
    private final boolean skipReceiver;
    private final boolean inferTypes;

    public SignatureExtractor() {
        this(DocSource.none(), new JavadocDocstringParser(), true, true);
    }

    public SignatureExtractor(DocSource docs, DocstringParser parser, boolean skipReceiver, boolean inferTypes) {
        this.docs = docs == null ? DocSource.none() : docs;
        this.parser = parser == null ? new JavadocDocstringParser() : parser;
        this.skipReceiver = skipReceiver;
        this.inferTypes = inferTypes;
    }

    public DocSource docSource() {
        return docs;
    }

    public Signature extract(Executable executable) {
        Objects.requireNonNull(executable, "executable");
        return extract(executable, nameOf(executable));
    }

    public Signature extract(Executable executable, String name) {
        Objects.requireNonNull(executable, "executable");
        Objects.requireNonNull(name, "name");

        List<Parameter> params = new ArrayList<>();
        if (!skipReceiver) receiverOf(executable).ifPresent(params::add);
        for (java.lang.reflect.Parameter p : declaredParameters(executable)) {
            params.add(parameterOf(executable, p));
        }

        ParsedDocstring doc = documentation(executable);
        List<Parameter> described = mergeDescriptions(params, doc);
        TypeDescriptor returnType = returnTypeOf(executable);

        LOG.debug("Extracted {}.{} with {} parameter(s)",
                executable.getDeclaringClass().getSimpleName(), name, described.size());
        return new Signature(name, described, returnType, doc.description(), doc.text);
    }

    /** Parsed documentation of a class, method or constructor; empty when there is none. */
    public ParsedDocstring documentation(AnnotatedElement element) {
        return docs.rawDoc(element).map(parser::parse).orElse(ParsedDocstring.EMPTY);
    }

    /**
     * New parameter list where each parameter documented with a non-empty description carries
     * it. Parameters without documentation are passed through unchanged.
     */
    public static List<Parameter> mergeDescriptions(List<Parameter> params, ParsedDocstring doc) {
        List<Parameter> out = new ArrayList<>(params.size());
        for (Parameter p : params) {
            out.add(doc.param(p.name).map(d -> p.withDescription(d.description)).orElse(p));
        }
        return out;
    }

    public static String nameOf(Executable executable) {
        return executable instanceof Constructor<?> ? Member.INIT_NAME : executable.getName();
    }

    /**
     * Parameters written in the source, in order. The outer instance of an inner-class
     * constructor, the name and ordinal of an enum constructor and other compiler-added
     * parameters are left out.
     */
    public static List<java.lang.reflect.Parameter> declaredParameters(Executable executable) {
        List<java.lang.reflect.Parameter> out = new ArrayList<>();
        for (java.lang.reflect.Parameter p : executable.getParameters()) {
            if (p.isImplicit() || p.isSynthetic()) continue;
            out.add(p);
        }
        return out;
    }

    private Parameter parameterOf(Executable executable, java.lang.reflect.Parameter p) {
        ParameterKind kind;
        AnnotatedType annotated = p.getAnnotatedType();
        Class<?> valueType = p.getType();
        if (p.isVarArgs()) {
            kind = ParameterKind.VAR_POSITIONAL;
            if (annotated instanceof AnnotatedArrayType) {
                annotated = ((AnnotatedArrayType) annotated).getAnnotatedGenericComponentType();
            }
            valueType = p.getType().getComponentType();
        } else if (!p.isNamePresent()) {
            kind = ParameterKind.POSITIONAL_ONLY;
        } else {
            kind = ParameterKind.POSITIONAL_OR_KEYWORD;
        }

        Object defaultValue = Unset.INSTANCE;
        Default d = p.getAnnotation(Default.class);
        if (d != null) {
            if (kind == ParameterKind.VAR_POSITIONAL) {
                throw new IllegalArgumentException("@Default on varargs parameter " + p.getName()
                        + " of " + executable.getDeclaringClass().getSimpleName() + "." + nameOf(executable));
            }
            try {
                defaultValue = DefaultValueParser.parse(d.value(), valueType);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Bad @Default on " + p.getName() + " of "
                        + executable.getDeclaringClass().getSimpleName() + "." + nameOf(executable)
                        + ": " + e.getMessage(), e);
            }
        }

        return new Parameter(p.getName(), kind, typeOf(annotated), defaultValue, null, inferTypes);
    }

    private Optional<Parameter> receiverOf(Executable executable) {
        if (!(executable instanceof Method) || Modifier.isStatic(executable.getModifiers())) {
            return Optional.empty();
        }
        AnnotatedType receiver = executable.getAnnotatedReceiverType();
        TypeDescriptor type = receiver == null
                ? TypeReader.read(executable.getDeclaringClass())
                : TypeReader.read(receiver);
        return Optional.of(new Parameter(RECEIVER_NAME, ParameterKind.POSITIONAL_ONLY, type, Unset.INSTANCE, null, false));
    }

    private static TypeDescriptor returnTypeOf(Executable executable) {
        if (!(executable instanceof Method)) return TypeDescriptor.unset();
        Method m = (Method) executable;
        if (m.getReturnType() == void.class) return TypeDescriptor.plain(void.class);
        return typeOf(m.getAnnotatedReturnType());
    }

    /** {@code Object} with no taxonomy annotation is untyped; everything else goes through {@link TypeReader}. */
    static TypeDescriptor typeOf(AnnotatedType annotated) {
        if (annotated == null) return TypeDescriptor.unset();
        if (annotated.getType() == Object.class && !hasTaxonomyAnnotation(annotated)) {
            return TypeDescriptor.unset();
        }
        return TypeReader.read(annotated);
    }

    private static boolean hasTaxonomyAnnotation(AnnotatedType annotated) {
        return annotated.isAnnotationPresent(Literal.class)
                || annotated.isAnnotationPresent(OneOf.class)
                || TypeReader.isNullable(annotated);
    }
}
