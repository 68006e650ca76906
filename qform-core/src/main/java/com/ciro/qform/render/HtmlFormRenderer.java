package com.ciro.qform.render;

import com.ciro.qform.model.Attribute;
import com.ciro.qform.model.Field;
import com.ciro.qform.model.FormModel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Modelo -> fragmento {@code <form>...</form>}. Función pura: no muta el modelo,
 * así que renderizar dos veces produce exactamente la misma salida.
 */
public final class HtmlFormRenderer {

    private final RenderConfig config;
    private final Map<String, FieldRenderer> strategies;
    private final FieldRenderer fallback;

    public HtmlFormRenderer() {
        this(new RenderConfig());
    }

    public HtmlFormRenderer(RenderConfig config) {
        this(config, defaultStrategies(), new InputFieldRenderer());
    }

    private HtmlFormRenderer(RenderConfig config, Map<String, FieldRenderer> strategies, FieldRenderer fallback) {
        this.config = Objects.requireNonNull(config, "config must not be null").copy();
        this.strategies = Collections.unmodifiableMap(new LinkedHashMap<>(strategies));
        this.fallback = fallback;
    }

    private static Map<String, FieldRenderer> defaultStrategies() {
        Map<String, FieldRenderer> m = new LinkedHashMap<>();
        m.put("textarea", new TextareaFieldRenderer());
        m.put("select", new SelectFieldRenderer());
        m.put("radio", new ChoiceFieldRenderer("radio"));
        m.put("checkbox", new ChoiceFieldRenderer("checkbox"));
        return m;
    }

    /** Copia con una estrategia extra (o reemplazada) para {@code inputType}. */
    public HtmlFormRenderer withStrategy(String inputType, FieldRenderer renderer) {
        Map<String, FieldRenderer> m = new LinkedHashMap<>(strategies);
        m.put(Objects.requireNonNull(inputType, "inputType"), Objects.requireNonNull(renderer, "renderer"));
        return new HtmlFormRenderer(config, m, fallback);
    }

    public RenderConfig config() {
        return config.copy();
    }

    public String render(FormModel model) {
        Objects.requireNonNull(model, "model must not be null");
        StringBuilder sb = new StringBuilder();

        sb.append("<form");
        for (Attribute a : model.getAttributes()) {
            sb.append(" ").append(a.name()).append("=\"").append(a.value()).append("\"");
        }
        sb.append(">\n");

        renderFields(model.getFields(), sb);

        sb.append("</form>\n");
        return sb.toString();
    }

    private void renderFields(List<Field> fields, StringBuilder sb) {
        for (int i = 0; i < fields.size(); i++) {
            ResolvedField field = ResolvedField.resolve(fields.get(i), i + 1, config);
            sb.append(config.indent(1)).append("<div class=\"").append(config.getGroupClass()).append("\">\n");
            strategies.getOrDefault(field.inputType(), fallback).render(field, sb, config);
            sb.append(config.indent(1)).append("</div>\n");
        }
    }
}
