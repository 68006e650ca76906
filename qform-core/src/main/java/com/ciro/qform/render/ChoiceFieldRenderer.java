package com.ciro.qform.render;

import java.util.Map;

/**
 * radio / checkbox: un input por opción, cada uno envuelto en su propio label.
 * No hay etiqueta de bloque, y el id solo va en el primer input para no duplicarlo en el DOM.
 */
public class ChoiceFieldRenderer extends AbstractFieldRenderer {

    private final String type;

    public ChoiceFieldRenderer(String type) {
        this.type = type;
    }

    @Override
    public void render(ResolvedField field, StringBuilder sb, RenderConfig config) {
        boolean first = true;
        for (Map.Entry<String, String> opt : field.options().entrySet()) {
            sb.append(config.indent(BODY)).append("<label><input");
            appendAttribute("type", type, sb);
            appendAttributes(field.attributes(), sb, !first);
            sb.append(" value=\"").append(opt.getKey()).append("\"/>")
              .append(opt.getValue())
              .append("</label>\n");
            first = false;
        }
    }
}
