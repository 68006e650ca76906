package com.ciro.qform.spring;

import com.ciro.qform.render.RenderConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "qform.render")
public class QFormProperties {
    /** Unidad de sangría del HTML generado */
    private String indent = "  ";
    /** Clase CSS del div que envuelve cada campo */
    private String groupClass = "form-group";
    /** Prefijo de los nombres autogenerados */
    private String autoNamePrefix = "field";

    public String getIndent() { return indent; }
    public void setIndent(String indent) { this.indent = indent; }

    public String getGroupClass() { return groupClass; }
    public void setGroupClass(String groupClass) { this.groupClass = groupClass; }

    public String getAutoNamePrefix() { return autoNamePrefix; }
    public void setAutoNamePrefix(String autoNamePrefix) { this.autoNamePrefix = autoNamePrefix; }

    RenderConfig toRenderConfig() {
        RenderConfig c = new RenderConfig();
        c.setIndent(indent);
        c.setGroupClass(groupClass);
        c.setAutoNamePrefix(autoNamePrefix);
        return c;
    }
}
