package info.isaksson.erland.typeinspect.model;

import info.isaksson.erland.typeinspect.taxonomy.TypeTaxonomy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered parameters and return type of one callable. Immutable.
 */
public final class Signature implements Inspectable {
    public final String name;
    /** Declaration order. Names are unique. */
    public final List<Parameter> parameters;
    public final TypeDescriptor returnType;
    /** Short description (or the long one when there is no short one). Never null. */
    public final String description;
    /** Normalized documentation text the description came from. Never null. */
    public final String docstring;

    private final Map<String, Parameter> byName;

    public Signature(String name,
                     List<Parameter> parameters,
                     TypeDescriptor returnType,
                     String description,
                     String docstring) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.returnType = returnType == null ? TypeDescriptor.unset() : returnType;
        this.description = Objects.requireNonNullElse(description, "");
        this.docstring = Objects.requireNonNullElse(docstring, "");

        Map<String, Parameter> index = new LinkedHashMap<>();
        for (Parameter p : this.parameters) {
            if (index.putIfAbsent(p.name, p) != null) {
                throw new IllegalArgumentException("Duplicate parameter '" + p.name + "' in " + name);
            }
        }
        this.byName = index;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    public boolean hasDocstring() {
        return !docstring.isEmpty();
    }

    public boolean hasParam(String paramName) {
        return byName.containsKey(paramName);
    }

    public Parameter getParam(String paramName) {
        return KeyLookup.byName(paramName, byName, "Parameter");
    }

    public Parameter getParam(int index) {
        return KeyLookup.byIndex(index, parameters, "Parameter");
    }

    /** Lookup by a {@link String} name or an integral index ({@link KeyLookup#byKey}). */
    public Parameter getParam(Object key) {
        return KeyLookup.byKey(key, byName, parameters, "Parameter");
    }

    public List<String> parameterNames() {
        return new ArrayList<>(byName.keySet());
    }

    /**
     * Order named arguments by declaration.
     *
     * <p>Missing optional parameters get their default; missing variadic parameters are left
     * out; a missing required parameter or an unknown name is rejected.</p>
     */
    public List<Object> bind(Map<String, ?> named) {
        Map<String, ?> args = named == null ? Map.of() : named;
        Set<String> unknown = new LinkedHashSet<>(args.keySet());
        unknown.removeAll(byName.keySet());
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unexpected argument(s) for " + name + ": " + unknown);
        }
        List<Object> out = new ArrayList<>();
        for (Parameter p : parameters) {
            if (args.containsKey(p.name)) {
                out.add(args.get(p.name));
            } else if (!isVariadic(p)) {
                if (!p.hasDefault()) {
                    throw new IllegalArgumentException("Missing required argument '" + p.name + "' for " + name);
                }
                out.add(p.defaultValue);
            }
        }
        return out;
    }

    /** Render strings of every parameter, for display collaborators. */
    public List<String> renderParameters() {
        List<String> out = new ArrayList<>();
        for (Parameter p : parameters) out.add(p.render());
        return out;
    }

    /** {@code name(a: int, b = 4) -> String}; the arrow is omitted for an unset return type. */
    public String render() {
        StringBuilder sb = new StringBuilder(name).append('(')
                .append(String.join(", ", renderParameters())).append(')');
        if (!returnType.isUnset()) sb.append(" -> ").append(TypeTaxonomy.renderName(returnType));
        return sb.toString();
    }

    @Override
    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name);
        List<Object> params = new ArrayList<>();
        for (Parameter p : parameters) params.add(p.toData());
        data.put("parameters", params);
        data.put("returnType", returnType.isUnset() ? null : TypeTaxonomy.renderName(returnType));
        data.put("description", description);
        data.put("docstring", docstring.isEmpty() ? null : docstring);
        return data;
    }

    private static boolean isVariadic(Parameter p) {
        return p.kind == ParameterKind.VAR_POSITIONAL || p.kind == ParameterKind.VAR_KEYWORD;
    }

    @Override public String toString() {
        return "Signature(name='" + name + "', parameters=" + parameters.size()
                + ", description='" + description + "')";
    }
}
