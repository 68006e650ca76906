package com.ciro.qform.render;

import com.ciro.qform.model.Field;
import com.ciro.qform.model.Labels;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Vista de render de un {@link Field}: nombre e id ya resueltos (autogenerados si faltaban)
 * y etiqueta efectiva calculada. El Field original no se toca.
 */
public record ResolvedField(String inputType,
                            String id,
                            String name,
                            String label,
                            Map<String, String> attributes,
                            Map<String, String> options) {

    /** Tipos que nunca llevan etiqueta implícita */
    private static final String SUBMIT = "submit";

    static ResolvedField resolve(Field field, int position, RenderConfig config) {
        Map<String, String> attrs = new LinkedHashMap<>(field.getAttributes());

        String name = field.getName();
        if (!field.hasName()) {
            name = config.getAutoNamePrefix() + position;
            attrs.put("name", name);
        }
        String id = field.getId();
        if (!field.hasId()) {
            id = name;
            attrs.put("id", name);
        }

        String label = null;
        if (field.hasLabel()) {
            label = field.getLabel();
        } else if (!SUBMIT.equals(field.getInputType())) {
            label = Labels.capitalize(name);
        }

        return new ResolvedField(field.getInputType(), id, name, label,
                Collections.unmodifiableMap(attrs),
                field.getOptions());
    }

    public boolean hasLabel() {
        return label != null;
    }
}
