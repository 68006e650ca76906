package com.ciro.qform.render;

import java.util.Map;

public class SelectFieldRenderer extends AbstractFieldRenderer {

    @Override
    public void render(ResolvedField field, StringBuilder sb, RenderConfig config) {
        renderLabel(field, sb, config);
        sb.append(config.indent(BODY)).append("<select");
        appendAttributes(field.attributes(), sb);
        sb.append(">\n");

        for (Map.Entry<String, String> opt : field.options().entrySet()) {
            sb.append(config.indent(BODY + 1))
              .append("<option value=\"").append(opt.getKey()).append("\">")
              .append(opt.getValue())
              .append("</option>\n");
        }

        sb.append(config.indent(BODY)).append("</select>\n");
    }
}
