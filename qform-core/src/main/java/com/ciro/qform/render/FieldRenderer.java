package com.ciro.qform.render;

/**
 * Estrategia de render para un tipo de input. Se elige por el tag del campo.
 */
public interface FieldRenderer {
    void render(ResolvedField field, StringBuilder sb, RenderConfig config);
}
