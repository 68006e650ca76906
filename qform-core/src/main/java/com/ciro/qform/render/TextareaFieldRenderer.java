package com.ciro.qform.render;

public class TextareaFieldRenderer extends AbstractFieldRenderer {

    @Override
    public void render(ResolvedField field, StringBuilder sb, RenderConfig config) {
        renderLabel(field, sb, config);
        sb.append(config.indent(BODY)).append("<textarea");
        appendAttributes(field.attributes(), sb);
        sb.append("></textarea>\n");
    }
}
