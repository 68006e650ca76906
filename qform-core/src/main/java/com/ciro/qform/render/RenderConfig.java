package com.ciro.qform.render;

/**
 * Opciones del renderer HTML. Los valores por defecto reproducen la salida clásica de Fast Forms.
 */
public class RenderConfig {
    /** Unidad de sangría por nivel */
    private String indent = "  ";
    /** Clase CSS del div que envuelve cada campo */
    private String groupClass = "form-group";
    /** Prefijo de los nombres autogenerados (field1, field2...) */
    private String autoNamePrefix = "field";

    public String getIndent() { return indent; }
    public void setIndent(String indent) { this.indent = indent; }

    public String getGroupClass() { return groupClass; }
    public void setGroupClass(String groupClass) { this.groupClass = groupClass; }

    public String getAutoNamePrefix() { return autoNamePrefix; }
    public void setAutoNamePrefix(String autoNamePrefix) { this.autoNamePrefix = autoNamePrefix; }

    public RenderConfig copy() {
        RenderConfig c = new RenderConfig();
        c.indent = indent;
        c.groupClass = groupClass;
        c.autoNamePrefix = autoNamePrefix;
        return c;
    }

    /** Sangría para el nivel {@code level} (0 = sin sangría). */
    public String indent(int level) {
        return indent.repeat(level);
    }
}
