package info.isaksson.erland.typeinspect.doc;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.comments.JavadocComment;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.github.javaparser.ast.nodeTypes.NodeWithTypeParameters;
import com.github.javaparser.ast.type.ArrayType;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.TypeParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads Javadoc comments from {@code .java} files under one or more source roots.
 *
 * <p>A class is looked up as {@code <root>/<package path>/<TopLevel>.java}; the first root that
 * has the file wins. Methods and constructors are matched by name and erased simple parameter
 * type names. Files that cannot be read or parsed are recorded in {@link #problems()} and
 * logged; lookups against them find nothing.</p>
 *
 * <p>Parsed compilation units are cached per file. Instances are safe for concurrent use.</p>
 */
public final class SourceJavadocSource implements DocSource {

    private static final Logger LOG = LoggerFactory.getLogger(SourceJavadocSource.class);

    private final List<Path> roots;
    private final JavaParser parser;
    private final Map<Path, Optional<CompilationUnit>> cache = new HashMap<>();
    private final List<String> parseErrors = new ArrayList<>();

    public SourceJavadocSource(List<Path> roots) {
        this.roots = roots == null ? List.of() : List.copyOf(roots);
        ParserConfiguration cfg = new ParserConfiguration();
        cfg.setCharacterEncoding(StandardCharsets.UTF_8);
        cfg.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(cfg);
    }

    public List<Path> roots() {
        return roots;
    }

    /** Problems met so far, one line per file: {@code <file>: <what went wrong>}. */
    @Override
    public synchronized List<String> problems() {
        return List.copyOf(parseErrors);
    }

    @Override
    public Optional<String> rawDoc(AnnotatedElement element) {
        if (element instanceof Class<?>) {
            Class<?> type = (Class<?>) element;
            return findType(type).flatMap(SourceJavadocSource::javadocOf);
        }
        if (element instanceof Executable) {
            Executable executable = (Executable) element;
            Optional<TypeDeclaration<?>> owner = findType(executable.getDeclaringClass());
            if (owner.isEmpty()) return Optional.empty();
            return findCallable(owner.get(), executable).flatMap(SourceJavadocSource::javadocOf);
        }
        return Optional.empty();
    }

    private Optional<TypeDeclaration<?>> findType(Class<?> type) {
        String canonical = type.getCanonicalName();
        if (canonical == null) return Optional.empty(); // local or anonymous
        Optional<CompilationUnit> cu = compilationUnitFor(topLevel(type));
        if (cu.isEmpty()) return Optional.empty();
        for (TypeDeclaration<?> td : cu.get().findAll(TypeDeclaration.class)) {
            if (td.getFullyQualifiedName().map(canonical::equals).orElse(false)) return Optional.of(td);
        }
        return Optional.empty();
    }

    private static Optional<CallableDeclaration<?>> findCallable(TypeDeclaration<?> td, Executable executable) {
        List<String> reflected = new ArrayList<>();
        for (Class<?> p : executable.getParameterTypes()) reflected.add(p.getSimpleName());

        List<CallableDeclaration<?>> candidates = new ArrayList<>();
        if (executable instanceof Constructor<?>) {
            candidates.addAll(td.getConstructors());
        } else if (executable instanceof Method) {
            candidates.addAll(td.getMethodsByName(executable.getName()));
        }

        Set<String> typeVars = new HashSet<>();
        for (TypeParameter tp : typeParametersOf(td)) typeVars.add(tp.getNameAsString());

        for (CallableDeclaration<?> cd : candidates) {
            // inner-class and enum constructors carry leading synthetic parameters
            List<String> declared = new ArrayList<>();
            for (Parameter p : cd.getParameters()) {
                String simple = erasedSimpleName(p.getType());
                declared.add(p.isVarArgs() ? simple + "[]" : simple);
            }
            int offset = reflected.size() - declared.size();
            if (offset < 0 || (offset > 0 && !(executable instanceof Constructor<?>))) continue;

            Set<String> vars = new HashSet<>(typeVars);
            for (TypeParameter tp : cd.getTypeParameters()) vars.add(tp.getNameAsString());

            boolean match = true;
            for (int i = 0; i < declared.size() && match; i++) {
                String d = declared.get(i);
                String r = reflected.get(i + offset);
                match = d.equals(r) || isTypeVariable(d, vars);
            }
            if (match) return Optional.of(cd);
        }
        return Optional.empty();
    }

    private static List<TypeParameter> typeParametersOf(TypeDeclaration<?> td) {
        if (td instanceof NodeWithTypeParameters<?>) {
            return ((NodeWithTypeParameters<?>) td).getTypeParameters();
        }
        return List.of();
    }

    private static boolean isTypeVariable(String declared, Set<String> vars) {
        String base = declared;
        while (base.endsWith("[]")) base = base.substring(0, base.length() - 2);
        return vars.contains(base);
    }

    /** {@code java.util.List<String>} becomes {@code List}, {@code int[]} stays {@code int[]}. */
    static String erasedSimpleName(Type type) {
        if (type instanceof ArrayType) {
            return erasedSimpleName(((ArrayType) type).getComponentType()) + "[]";
        }
        if (type instanceof ClassOrInterfaceType) {
            return ((ClassOrInterfaceType) type).getNameAsString();
        }
        return type.asString();
    }

    private static Optional<String> javadocOf(BodyDeclaration<?> declaration) {
        if (!(declaration instanceof NodeWithJavadoc<?>)) return Optional.empty();
        return ((NodeWithJavadoc<?>) declaration).getJavadocComment().map(JavadocComment::getContent);
    }

    private static Class<?> topLevel(Class<?> type) {
        Class<?> t = type;
        while (t.getEnclosingClass() != null) t = t.getEnclosingClass();
        return t;
    }

    private synchronized Optional<CompilationUnit> compilationUnitFor(Class<?> topLevel) {
        String relative = topLevel.getName().replace('.', '/') + ".java";
        for (Path root : roots) {
            Path file = root.resolve(relative);
            if (!Files.isRegularFile(file)) continue;
            return cache.computeIfAbsent(file.toAbsolutePath().normalize(), f -> parse(root, f));
        }
        return Optional.empty();
    }

    private Optional<CompilationUnit> parse(Path root, Path file) {
        try {
            String code = Files.readString(file, StandardCharsets.UTF_8);
            ParseResult<CompilationUnit> result = parser.parse(code);
            if (!result.isSuccessful()) throw new ParseProblemException(result.getProblems());
            CompilationUnit cu = result.getResult()
                    .orElseThrow(() -> new ParseProblemException(List.of()));
            LOG.debug("Parsed {}", file);
            return Optional.of(cu);
        } catch (ParseProblemException e) {
            recordError(root, file, "parse error (" + e.getProblems().size() + " problems)");
        } catch (IOException e) {
            recordError(root, file, "IO error (" + e.getMessage() + ")");
        }
        return Optional.empty();
    }

    private void recordError(Path root, Path file, String what) {
        String entry = rel(root, file) + ": " + what;
        parseErrors.add(entry);
        LOG.warn("Could not read documentation from {}", entry);
    }

    private static String rel(Path root, Path file) {
        try {
            return root.toAbsolutePath().normalize().relativize(file).toString().replace('\\', '/');
        } catch (IllegalArgumentException e) {
            return file.toString().replace('\\', '/');
        }
    }
}
