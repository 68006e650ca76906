package com.ciro.qform;

import com.ciro.qform.dialect.FastFormsDialect;
import com.ciro.qform.error.QFormException;
import com.ciro.qform.model.FormModel;
import com.ciro.qform.render.HtmlFormRenderer;
import com.ciro.qform.render.RenderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Fachada: texto Fast Forms -> HTML. Inmutable y thread-safe; cada llamada usa su propio modelo.
 *
 * <pre>
 * String html = new FastForms().convert("text\n- name email\n");
 * </pre>
 */
public class FastForms {

    private static final Logger log = LoggerFactory.getLogger(FastForms.class);

    private final FastFormsDialect dialect;

    public FastForms() {
        this(new RenderConfig());
    }

    public FastForms(RenderConfig config) {
        this(new FastFormsDialect(new HtmlFormRenderer(config)));
    }

    public FastForms(FastFormsDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    public FastFormsDialect dialect() {
        return dialect;
    }

    /** Solo el análisis: texto -> modelo. */
    public FormModel parseModel(String source) {
        return dialect.parse(source);
    }

    public String render(FormModel model) {
        return dialect.render(model);
    }

    /**
     * @throws QFormException (o una subclase) si el texto no es válido
     */
    public String convert(String source) {
        FormModel model = parseModel(source);
        String html = render(model);
        log.debug("Converted form: {} attributes, {} fields, {} chars of HTML",
                model.getAttributes().size(), model.getFields().size(), html.length());
        return html;
    }

    /** Igual que {@link #convert} pero el error viaja en el resultado en vez de lanzarse. */
    public ConversionResult parse(String source) {
        try {
            return ConversionResult.success(convert(source));
        } catch (QFormException e) {
            log.debug("Fast Forms conversion failed: {}", e.getMessage());
            return ConversionResult.failure(e);
        }
    }
}
