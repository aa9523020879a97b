package info.isaksson.erland.typeinspect.core;

import info.isaksson.erland.typeinspect.extract.SignatureExtractor;

import java.lang.reflect.Executable;
import java.lang.reflect.Parameter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Something left out of a {@link ClassMetadata} that did not stop the inspection: an overload
 * that was not listed, or a documentation source that could not be read.
 */
public final class InspectWarning {

    public enum Code {
        /** Overload not listed because another overload of the same name was kept. */
        OVERLOAD_DROPPED,
        /** A documentation source file could not be read or parsed. */
        DOC_SOURCE_ERROR
    }

    public final Code code;

    /** Name of the member the warning is about; null for type-level warnings. */
    public final String member;

    /** The callable that was left out; null when the warning is not about one. */
    public final Executable executable;

    public final String message;

    /** Structured details with stable keys ({@code kept}, {@code dropped}). */
    public final Map<String, String> context;

    InspectWarning(Code code, String member, Executable executable, String message, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code");
        this.member = member;
        this.executable = executable;
        this.message = Objects.requireNonNull(message, "message");
        this.context = context == null || context.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    static InspectWarning overloadDropped(String member, Executable kept, Executable dropped) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put("kept", parameterList(kept));
        ctx.put("dropped", parameterList(dropped));
        return new InspectWarning(Code.OVERLOAD_DROPPED, member, dropped,
                member + parameterList(dropped) + " not listed; " + member + parameterList(kept) + " was kept", ctx);
    }

    static InspectWarning docSourceError(String problem) {
        return new InspectWarning(Code.DOC_SOURCE_ERROR, null, null, problem, null);
    }

    /** {@code (String, int)}: simple names of the parameters written in the source. */
    static String parameterList(Executable executable) {
        List<Parameter> params = SignatureExtractor.declaredParameters(executable);
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(params.get(i).getType().getSimpleName());
        }
        return sb.append(')').toString();
    }

    @Override public String toString() {
        return code + (member == null ? "" : " " + member) + ": " + message;
    }
}
