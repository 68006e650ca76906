package com.ciro.qform.render;

import java.util.Map;

/**
 * Piezas comunes: etiqueta de bloque y serialización de atributos en orden de declaración.
 * Los valores se emiten tal cual vienen del modelo.
 */
public abstract class AbstractFieldRenderer implements FieldRenderer {

    /** Nivel de sangría de los elementos dentro del div del grupo */
    protected static final int BODY = 2;

    protected void renderLabel(ResolvedField field, StringBuilder sb, RenderConfig config) {
        if (!field.hasLabel()) return;
        sb.append(config.indent(BODY))
          .append("<label for=\"").append(field.id()).append("\">")
          .append(field.label())
          .append("</label>\n");
    }

    protected void appendAttributes(Map<String, String> attributes, StringBuilder sb) {
        appendAttributes(attributes, sb, false);
    }

    /** Con {@code skipId} se omite el id (inputs repetidos de radio/checkbox). */
    protected void appendAttributes(Map<String, String> attributes, StringBuilder sb, boolean skipId) {
        for (Map.Entry<String, String> e : attributes.entrySet()) {
            if (skipId && "id".equals(e.getKey())) continue;
            appendAttribute(e.getKey(), e.getValue(), sb);
        }
    }

    protected void appendAttribute(String name, String value, StringBuilder sb) {
        sb.append(" ").append(name).append("=\"").append(value).append("\"");
    }
}
