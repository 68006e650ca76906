package com.ciro.qform.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Acumulador semántico de un parse: atributos del &lt;form&gt; y campos, ambos en orden.
 * Pertenece a un único parse; no se comparte entre hilos.
 */
public final class FormModel {

    private final List<Attribute> attributes = new ArrayList<>();
    private final List<Field> fields = new ArrayList<>();

    public FormModel addAttribute(Attribute attribute) {
        attributes.add(Objects.requireNonNull(attribute, "attribute must not be null"));
        return this;
    }

    public FormModel addField(Field field) {
        fields.add(Objects.requireNonNull(field, "field must not be null"));
        return this;
    }

    public List<Attribute> getAttributes() {
        return Collections.unmodifiableList(attributes);
    }

    public List<Field> getFields() {
        return Collections.unmodifiableList(fields);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FormModel m && attributes.equals(m.attributes) && fields.equals(m.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, fields);
    }

    @Override
    public String toString() {
        return "FormModel{attributes=" + attributes + ", fields=" + fields + "}";
    }
}
