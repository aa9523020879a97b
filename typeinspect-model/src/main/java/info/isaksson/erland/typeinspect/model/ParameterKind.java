package info.isaksson.erland.typeinspect.model;

/**
 * How an argument binds to a parameter.
 *
 * <p>Reflection produces {@link #POSITIONAL_OR_KEYWORD} for parameters compiled with their
 * names, {@link #POSITIONAL_ONLY} for synthesized names ({@code arg0}) and for an explicit
 * receiver, and {@link #VAR_POSITIONAL} for a varargs parameter. The keyword kinds are only
 * produced by hand-built signatures.</p>
 */
public enum ParameterKind {
    POSITIONAL_ONLY,
    POSITIONAL_OR_KEYWORD,
    VAR_POSITIONAL,
    KEYWORD_ONLY,
    VAR_KEYWORD
}
