package com.ciro.qform.render;

/** Cualquier tipo sin estrategia propia: text, email, password, submit... */
public class InputFieldRenderer extends AbstractFieldRenderer {

    @Override
    public void render(ResolvedField field, StringBuilder sb, RenderConfig config) {
        renderLabel(field, sb, config);
        sb.append(config.indent(BODY)).append("<input");
        appendAttribute("type", field.inputType(), sb);
        appendAttributes(field.attributes(), sb);
        sb.append(" />\n");
    }
}
