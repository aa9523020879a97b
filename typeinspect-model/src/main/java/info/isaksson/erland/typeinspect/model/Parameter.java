package info.isaksson.erland.typeinspect.model;

import info.isaksson.erland.typeinspect.taxonomy.TypeReader;
import info.isaksson.erland.typeinspect.taxonomy.TypeTaxonomy;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One parameter of a callable: name, kind, type, default value and description.
 *
 * <p>When no type is given and a default is, the type is inferred from the runtime type of the
 * default (a {@code null} default gives {@link TypeDescriptor#nullType()}). Inference happens
 * once, in the constructor.</p>
 */
public final class Parameter {
    public final String name;
    public final ParameterKind kind;
    public final TypeDescriptor type;
    /** The default value, possibly {@code null}, or {@link Unset#INSTANCE} when there is none. */
    public final Object defaultValue;
    /** Description from the documentation. May be null. */
    public final String description;

    public Parameter(String name, ParameterKind kind) {
        this(name, kind, TypeDescriptor.unset(), Unset.INSTANCE, null, true);
    }

    public Parameter(String name, ParameterKind kind, TypeDescriptor type, Object defaultValue, String description) {
        this(name, kind, type, defaultValue, description, true);
    }

    public Parameter(String name,
                     ParameterKind kind,
                     TypeDescriptor type,
                     Object defaultValue,
                     String description,
                     boolean inferType) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = kind == null ? ParameterKind.POSITIONAL_OR_KEYWORD : kind;
        this.defaultValue = defaultValue;
        this.description = description;
        TypeDescriptor declared = type == null ? TypeDescriptor.unset() : type;
        if (inferType && declared.isUnset() && !Unset.isUnset(defaultValue)) {
            declared = TypeReader.valueType(defaultValue);
        }
        this.type = declared;
    }

    private Parameter(Parameter source, String description) {
        this.name = source.name;
        this.kind = source.kind;
        this.type = source.type;
        this.defaultValue = source.defaultValue;
        this.description = description;
    }

    /** Copy with another description. The type is carried over, not inferred again. */
    public Parameter withDescription(String description) {
        return new Parameter(this, description);
    }

    public boolean isTyped() {
        return !type.isUnset();
    }

    public boolean isRequired() {
        return Unset.isUnset(defaultValue);
    }

    public boolean isOptional() {
        return !isRequired();
    }

    public boolean hasDefault() {
        return !Unset.isUnset(defaultValue);
    }

    /** {@code name: Type = default}, leaving out the parts that are not set. */
    public String render() {
        StringBuilder sb = new StringBuilder(name);
        if (isTyped()) sb.append(": ").append(TypeTaxonomy.renderName(type));
        if (hasDefault()) sb.append(" = ").append(DataValues.render(defaultValue));
        return sb.toString();
    }

    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name);
        data.put("kind", kind.name());
        data.put("type", isTyped() ? TypeTaxonomy.renderName(type) : null);
        data.put("hasDefault", hasDefault());
        data.put("default", DataValues.toData(defaultValue));
        data.put("description", description);
        return data;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Parameter)) return false;
        Parameter that = (Parameter) o;
        return Objects.equals(name, that.name) &&
                kind == that.kind &&
                Objects.equals(type, that.type) &&
                Objects.equals(defaultValue, that.defaultValue) &&
                Objects.equals(description, that.description);
    }

    @Override public int hashCode() {
        return Objects.hash(name, kind, type, defaultValue, description);
    }

    @Override public String toString() {
        return "Parameter(name='" + name + "', kind=" + kind + ", type=" + type
                + ", default=" + defaultValue + ", description='" + description + "')";
    }
}
