package com.ciro.qform.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Un control del formulario. Inmutable: se arma con {@link Builder} mientras se visitan
 * los atributos del bloque y ya no cambia.
 * <p>
 * Los mapas de atributos y opciones conservan el orden de declaración, que es el orden de salida.
 */
public final class Field {

    private final String inputType;
    private final String label;
    private final String id;
    private final String name;
    private final Map<String, String> attributes;
    private final Map<String, String> options;

    private Field(Builder b) {
        this.inputType = b.inputType;
        this.label = b.label;
        this.id = b.id;
        this.name = b.name;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(b.attributes));
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(b.options));
    }

    public static Builder builder(String inputType) {
        return new Builder(inputType);
    }

    public String getInputType() { return inputType; }
    public String getLabel() { return label; }
    public String getId() { return id; }
    public String getName() { return name; }
    public Map<String, String> getAttributes() { return attributes; }
    /** valor -> etiqueta */
    public Map<String, String> getOptions() { return options; }

    public boolean hasLabel() { return label != null && !label.isEmpty(); }
    public boolean hasId() { return id != null && !id.isEmpty(); }
    public boolean hasName() { return name != null && !name.isEmpty(); }

    public Builder toBuilder() {
        Builder b = new Builder(inputType);
        b.label = label;
        b.id = id;
        b.name = name;
        b.attributes.putAll(attributes);
        b.options.putAll(options);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Field f)) return false;
        return inputType.equals(f.inputType)
                && Objects.equals(label, f.label)
                && Objects.equals(id, f.id)
                && Objects.equals(name, f.name)
                // el orden forma parte de la identidad
                && attributes.entrySet().stream().toList().equals(f.attributes.entrySet().stream().toList())
                && options.entrySet().stream().toList().equals(f.options.entrySet().stream().toList());
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputType, label, id, name, attributes, options);
    }

    @Override
    public String toString() {
        return "Field{" + inputType + ", name=" + name + ", id=" + id + ", label=" + label
                + ", attributes=" + attributes + ", options=" + options + "}";
    }

    public static final class Builder {
        private final String inputType;
        private String label;
        private String id;
        private String name;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final Map<String, String> options = new LinkedHashMap<>();

        private Builder(String inputType) {
            this.inputType = Objects.requireNonNull(inputType, "inputType must not be null");
        }

        public Builder label(String label) { this.label = label; return this; }
        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }

        public Builder attribute(String key, String value) {
            attributes.put(key, value == null ? key : value);
            return this;
        }

        /** Sin etiqueta explícita se usa el valor capitalizado. */
        public Builder option(String value, String optionLabel) {
            options.put(value, optionLabel == null ? Labels.capitalize(value) : optionLabel);
            return this;
        }

        public Field build() {
            return new Field(this);
        }
    }
}
