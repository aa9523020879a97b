package info.isaksson.erland.typeinspect.core;

import info.isaksson.erland.typeinspect.doc.ParsedDocstring;
import info.isaksson.erland.typeinspect.error.AlreadyInitializedException;
import info.isaksson.erland.typeinspect.error.NotInitializedException;
import info.isaksson.erland.typeinspect.error.UnsupportedObjectException;
import info.isaksson.erland.typeinspect.extract.SignatureExtractor;
import info.isaksson.erland.typeinspect.model.Inspectable;
import info.isaksson.erland.typeinspect.model.KeyLookup;
import info.isaksson.erland.typeinspect.model.Member;
import info.isaksson.erland.typeinspect.model.Parameter;
import info.isaksson.erland.typeinspect.model.ParameterKind;
import info.isaksson.erland.typeinspect.model.Signature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Members of an inspected type, plus an optional live instance to call them on.
 *
 * <p>Members are keyed by name: {@code <init>} (the constructor) first, then methods sorted by
 * name. Methods defined at several hierarchy levels are taken from the most-derived level.
 * Each overloaded name is settled before any filtering: the most visible overload wins, then
 * the one with the most parameters, then the first by parameter type names. The
 * {@link MemberFilter} then only decides whether that overload is listed, so a wider filter
 * lists a superset of the same members. Overloads that lose to a listed member are reported
 * as {@link InspectWarning}s.</p>
 *
 * <p>The member table is fixed at construction. The instance is set once, either up front
 * (when an instance was inspected) or by {@link #init}. Not thread-safe.</p>
 */
public final class ClassMetadata implements Inspectable {

    private static final Logger LOG = LoggerFactory.getLogger(ClassMetadata.class);

    /** Arguments of {@link #splitInitArgs}: the constructor's share and the method's share. */
    public static final class SplitArgs {
        public final Map<String, Object> initArgs;
        public final Map<String, Object> methodArgs;

        SplitArgs(Map<String, Object> initArgs, Map<String, Object> methodArgs) {
            this.initArgs = Collections.unmodifiableMap(initArgs);
            this.methodArgs = Collections.unmodifiableMap(methodArgs);
        }
    }

    private final Class<?> type;
    private final String name;
    private final Map<String, Member> members;
    private final List<Member> memberList;
    /** Constructor {@link #init} calls; chosen whether or not {@code <init>} is listed. */
    private final Member constructor;
    private final MemberFilter filter;
    private final String description;
    private final String docstring;
    private final boolean receivedInstance;
    private final List<InspectWarning> warnings;

    private Object instance;
    private boolean instantiated;

    private ClassMetadata(Class<?> type,
                          Object instance,
                          Map<String, Member> members,
                          Member constructor,
                          MemberFilter filter,
                          ParsedDocstring doc,
                          List<InspectWarning> warnings) {
        this.type = type;
        this.instance = instance;
        this.instantiated = instance != null;
        this.receivedInstance = instance != null;
        this.name = instance == null ? displayName(type) : displayName(type) + " instance";
        this.members = Collections.unmodifiableMap(members);
        this.memberList = List.copyOf(members.values());
        this.constructor = constructor;
        this.filter = filter;
        this.description = doc.description();
        this.docstring = doc.text;
        this.warnings = warnings;
    }

    /**
     * Inspect {@code type}, or the class of {@code instance} when an instance is given.
     *
     * @throws UnsupportedObjectException for primitive, array and annotation types
     */
    public static ClassMetadata inspect(Class<?> type, Object instance, SignatureExtractor extractor, MemberFilter filter) {
        Objects.requireNonNull(extractor, "extractor");
        Class<?> target = instance != null ? instance.getClass() : Objects.requireNonNull(type, "type");
        if (target.isPrimitive() || target.isArray() || target.isAnnotation()) {
            throw new UnsupportedObjectException("Cannot inspect " + target.getTypeName());
        }
        MemberFilter f = filter == null ? MemberFilter.defaults() : filter;
        InspectWarnings warnings = new InspectWarnings();
        int docProblemsBefore = extractor.docSource().problems().size();

        TypeHierarchy hierarchy = TypeHierarchy.of(target);
        Map<String, Member> members = new TreeMap<>();
        for (Map.Entry<String, List<Method>> e : methodsByName(hierarchy).entrySet()) {
            List<Member> candidates = new ArrayList<>();
            for (Method m : e.getValue()) candidates.add(member(target, e.getKey(), m, hierarchy, extractor));
            List<Member> ranked = rank(candidates);
            Member kept = ranked.get(0);
            if (f.test(kept)) {
                members.put(kept.name(), kept);
                warnings.overloadsDropped(kept.name(), kept.executable, executables(ranked.subList(1, ranked.size())));
            }
        }

        Member constructor = null;
        Map<String, Member> ordered = new LinkedHashMap<>();
        if (isInstantiable(target)) {
            List<Member> candidates = new ArrayList<>();
            for (Constructor<?> c : target.getDeclaredConstructors()) {
                if (c.isSynthetic()) continue;
                candidates.add(member(target, Member.INIT_NAME, c, hierarchy, extractor));
            }
            if (!candidates.isEmpty()) {
                List<Member> ranked = rank(candidates);
                Member kept = ranked.get(0);
                if (f.admits(kept)) {
                    constructor = kept;
                    warnings.overloadsDropped(Member.INIT_NAME, kept.executable, executables(ranked.subList(1, ranked.size())));
                }
                if (f.test(kept)) ordered.put(Member.INIT_NAME, kept);
            }
        }
        ordered.putAll(members);

        ParsedDocstring doc = extractor.documentation(target);

        List<String> docProblems = extractor.docSource().problems();
        warnings.docSourceErrors(docProblems.subList(Math.min(docProblemsBefore, docProblems.size()), docProblems.size()));

        LOG.debug("Inspected {}: {} member(s), {} warning(s)", target.getName(), ordered.size(),
                warnings.toDeterministicList().size());
        return new ClassMetadata(target, instance, ordered, constructor, f, doc, warnings.toDeterministicList());
    }

    // ---------------------------------------------------------------- lookup

    public Class<?> type() {
        return type;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    /** Normalized documentation text of the type; empty when undocumented. */
    public String docstring() {
        return docstring;
    }

    public boolean hasDocstring() {
        return !docstring.isEmpty();
    }

    /** Listed members, {@code <init>} first. */
    public List<Member> members() {
        return memberList;
    }

    public List<String> memberNames() {
        return new ArrayList<>(members.keySet());
    }

    public boolean hasMember(String memberName) {
        return members.containsKey(memberName);
    }

    public Member getMember(String memberName) {
        return KeyLookup.byName(memberName, members, "Member");
    }

    public Member getMember(int index) {
        return KeyLookup.byIndex(index, memberList, "Member");
    }

    /** Lookup by a {@link String} name or an integral index ({@link KeyLookup#byKey}). */
    public Member getMember(Object selector) {
        return KeyLookup.byKey(selector, members, memberList, "Member");
    }

    public boolean hasInit() {
        return members.containsKey(Member.INIT_NAME);
    }

    /** The listed {@code <init>} member. */
    public Optional<Member> initMember() {
        return Optional.ofNullable(members.get(Member.INIT_NAME));
    }

    /** Parameters of the listed {@code <init>} member. */
    public Optional<List<Parameter>> initParams() {
        return initMember().map(Member::params);
    }

    public MemberFilter filter() {
        return filter;
    }

    public List<InspectWarning> warnings() {
        return warnings;
    }

    // ---------------------------------------------------------------- instance

    public boolean isInstantiated() {
        return instantiated;
    }

    /** True when this metadata was built from an existing instance rather than a class. */
    public boolean receivedInstance() {
        return receivedInstance;
    }

    public Optional<Object> instance() {
        return Optional.ofNullable(instance);
    }

    /**
     * Construct the instance with positional arguments. Missing trailing arguments take their
     * defaults.
     *
     * @throws AlreadyInitializedException if there already is an instance
     * @throws UnsupportedObjectException  if the type cannot be instantiated
     */
    public Object init(Object... args) {
        Member c = requireConstructor();
        Object[] full = withDefaults(invocable(c), args);
        instance = Invocations.construct((Constructor<?>) c.executable, full);
        instantiated = true;
        LOG.debug("Initialized {}", type.getName());
        return instance;
    }

    /** Construct the instance with arguments keyed by constructor parameter name. */
    public Object initWith(Map<String, ?> args) {
        Member c = requireConstructor();
        return init(invocable(c).bind(args).toArray());
    }

    /**
     * Call a method by name or index with positional arguments. Missing trailing arguments take
     * their defaults.
     *
     * @throws NotInitializedException if the member needs an instance and there is none
     */
    public Object callMethod(Object selector, Object... args) {
        Member m = callable(selector);
        return Invocations.invoke((Method) m.executable, receiverFor(m), withDefaults(invocable(m), args));
    }

    /** Call a method with arguments keyed by parameter name. */
    public Object callMethodWith(Object selector, Map<String, ?> args) {
        Member m = callable(selector);
        return Invocations.invoke((Method) m.executable, receiverFor(m), invocable(m).bind(args).toArray());
    }

    /** Like {@link #callMethod} but waits for {@code CompletionStage} and {@code Future} results. */
    public Object callMethodAwaiting(Object selector, Object... args) {
        return Invocations.await(callMethod(selector, args));
    }

    /**
     * Split named arguments between the constructor and the {@code target} method.
     *
     * <p>When the target needs an instance and {@code <init>} is listed, names that are
     * constructor parameters go to the constructor and the rest to the method. Otherwise
     * everything goes to the method.</p>
     */
    public SplitArgs splitInitArgs(Map<String, ?> args, Object target) {
        Member method = getMember(target);
        Map<String, Object> init = new LinkedHashMap<>();
        Map<String, Object> rest = new LinkedHashMap<>();
        Optional<Member> initMember = initMember();
        boolean split = method.requiresInstance() && initMember.isPresent();
        for (Map.Entry<String, ?> e : (args == null ? Map.<String, Object>of() : args).entrySet()) {
            if (split && initMember.get().signature.hasParam(e.getKey())) {
                init.put(e.getKey(), e.getValue());
            } else {
                rest.put(e.getKey(), e.getValue());
            }
        }
        return new SplitArgs(init, rest);
    }

    // ---------------------------------------------------------------- projection

    @Override
    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name);
        List<Object> ms = new ArrayList<>();
        for (Member m : memberList) ms.add(m.toData());
        data.put("members", ms);
        data.put("description", description);
        data.put("initialized", instantiated);
        data.put("docstring", docstring.isEmpty() ? null : docstring);
        return data;
    }

    /** Plain-text outline: {@code class Name:}, the description, then one indented line per member. */
    public String render(int indent) {
        StringBuilder sb = new StringBuilder("class ").append(name).append(':');
        if (!description.isEmpty()) sb.append('\n').append(description);
        String pad = " ".repeat(Math.max(0, indent));
        for (Member m : memberList) {
            sb.append('\n').append(pad).append(m.signature.render());
            if (!m.description().isEmpty()) sb.append("  # ").append(m.description());
        }
        return sb.toString();
    }

    @Override public String toString() {
        return "ClassMetadata(name='" + name + "', members=" + memberList.size()
                + ", hasInit=" + hasInit() + ", description='" + description + "')";
    }

    // ---------------------------------------------------------------- internals

    private Member requireConstructor() {
        if (instantiated) throw new AlreadyInitializedException(name + " is already initialized");
        if (!isInstantiable(type)) throw new UnsupportedObjectException("Cannot instantiate " + type.getTypeName());
        if (constructor == null) throw new UnsupportedObjectException(type.getTypeName() + " has no usable constructor");
        return constructor;
    }

    private Member callable(Object selector) {
        Member m = getMember(selector);
        if (m.isConstructor()) {
            throw new IllegalArgumentException("Constructors are called through init, not callMethod");
        }
        if (m.requiresInstance() && !instantiated) {
            throw new NotInitializedException(m.name() + " needs an instance of " + type.getSimpleName() + "; call init first");
        }
        return m;
    }

    private Object receiverFor(Member m) {
        return Modifier.isStatic(m.executable.getModifiers()) ? null : instance;
    }

    /** The signature without a leading receiver parameter. */
    private static Signature invocable(Member m) {
        List<Parameter> params = m.signature.parameters;
        if (params.isEmpty() || !isReceiver(params.get(0))) return m.signature;
        Signature s = m.signature;
        return new Signature(s.name, params.subList(1, params.size()), s.returnType, s.description, s.docstring);
    }

    private static boolean isReceiver(Parameter p) {
        return p.kind == ParameterKind.POSITIONAL_ONLY && SignatureExtractor.RECEIVER_NAME.equals(p.name);
    }

    /** Pad trailing positional arguments with defaults; varargs are left to packing. */
    static Object[] withDefaults(Signature signature, Object[] args) {
        Object[] given = args == null ? new Object[0] : args;
        List<Parameter> params = signature.parameters;
        if (given.length >= params.size()) return given;

        List<Object> out = new ArrayList<>(Arrays.asList(given));
        for (int i = given.length; i < params.size(); i++) {
            Parameter p = params.get(i);
            if (p.kind == ParameterKind.VAR_POSITIONAL) break;
            if (!p.hasDefault()) {
                throw new IllegalArgumentException("Missing required argument '" + p.name + "' for " + signature.name);
            }
            out.add(p.defaultValue);
        }
        return out.toArray();
    }

    private static Map<String, List<Method>> methodsByName(TypeHierarchy hierarchy) {
        Map<String, List<Method>> out = new LinkedHashMap<>();
        for (Class<?> level : hierarchy.levels) {
            Map<String, List<Method>> atLevel = new LinkedHashMap<>();
            for (Method m : hierarchy.declaredMethods(level)) {
                if (out.containsKey(m.getName())) continue;
                atLevel.computeIfAbsent(m.getName(), k -> new ArrayList<>()).add(m);
            }
            out.putAll(atLevel);
        }
        return out;
    }

    private static Member member(Class<?> owner, String memberName, Executable executable,
                                 TypeHierarchy hierarchy, SignatureExtractor extractor) {
        Signature signature = extractor.extract(executable, memberName);
        MemberClassifier.Classification c = MemberClassifier.classify(memberName, executable, hierarchy);
        return new Member(signature, owner, c.definingType, c.kind, c.visibility, c.inherited, executable);
    }

    /** Overloads of one name, best first: most visible, then most parameters, then by parameter type names. */
    static List<Member> rank(List<Member> overloads) {
        List<Member> ranked = new ArrayList<>(overloads);
        ranked.sort(Comparator
                .comparing((Member m) -> m.visibility)
                .thenComparingInt(m -> -m.params().size())
                .thenComparing(m -> InspectWarning.parameterList(m.executable)));
        return ranked;
    }

    private static List<Executable> executables(List<Member> members) {
        List<Executable> out = new ArrayList<>();
        for (Member m : members) out.add(m.executable);
        return out;
    }

    /**
     * Whether {@link #init} can build an instance without help. Inner, local and anonymous
     * classes need an enclosing instance or captured state, so only inspected instances of
     * them are supported.
     */
    static boolean isInstantiable(Class<?> type) {
        return !type.isInterface()
                && !type.isEnum()
                && !type.isPrimitive()
                && !type.isArray()
                && !Modifier.isAbstract(type.getModifiers())
                && !needsEnclosingInstance(type);
    }

    private static boolean needsEnclosingInstance(Class<?> type) {
        if (type.isAnonymousClass() || type.isLocalClass()) return true;
        return type.isMemberClass() && !Modifier.isStatic(type.getModifiers());
    }

    private static String displayName(Class<?> type) {
        String simple = type.getSimpleName();
        return simple.isEmpty() ? type.getName() : simple;
    }
}
