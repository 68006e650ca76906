package com.ciro.qform.dialect;

import com.ciro.qform.grammar.Grammar;
import com.ciro.qform.model.FormModel;
import com.ciro.qform.render.HtmlFormRenderer;
import com.ciro.qform.spi.Dialect;
import com.ciro.qform.spi.DialectInfo;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dialecto Fast Forms: texto compacto orientado a líneas -> formulario HTML5.
 * La gramática se construye una sola vez y se comparte; el renderer es configurable.
 */
public final class FastFormsDialect implements Dialect<FormModel> {

    public static final String TITLE = "Fast Forms";
    public static final String VERSION = "1.0";

    private static final Grammar<FormModel> GRAMMAR = FastFormsGrammar.create();

    private static final DialectInfo INFO = new DialectInfo(
            TITLE,
            "The Fast Forms DSL speeds the creation of HTML5 forms, often cutting the number of characters required in half.",
            GRAMMAR.rootName(),
            VERSION,
            examples());

    private final HtmlFormRenderer renderer;

    public FastFormsDialect() {
        this(new HtmlFormRenderer());
    }

    public FastFormsDialect(HtmlFormRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    @Override public DialectInfo info() { return INFO; }
    @Override public Grammar<FormModel> grammar() { return GRAMMAR; }
    @Override public Class<FormModel> modelType() { return FormModel.class; }
    @Override public FormModel newModel() { return new FormModel(); }

    @Override
    public String render(FormModel model) {
        return renderer.render(model);
    }

    public HtmlFormRenderer renderer() {
        return renderer;
    }

    /**
     * El lenguaje es sensible a los saltos de línea: CRLF/CR pasan a LF y se garantiza un
     * salto final para que la última línea de tipo o atributo de form cierre bien.
     */
    @Override
    public String prepare(String source) {
        Objects.requireNonNull(source, "source must not be null");
        String text = source.replace("\r\n", "\n").replace('\r', '\n');
        if (!text.isEmpty() && !text.endsWith("\n")) {
            text = text + "\n";
        }
        return text;
    }

    private static Map<String, String> examples() {
        Map<String, String> ex = new LinkedHashMap<>();
        ex.put("Basic Contact Form", """
                - method post

                text
                - name name
                - maxlength 30
                - required

                email
                - name email

                textarea
                - name message

                submit
                - value Send message""");
        ex.put("Option Fields", """
                radio
                - name preference
                - [
                  call Call me back
                  email Email me a message
                  mail Send me a letter
                ]

                checkbox
                - name permission
                - [
                  yes I give my permission to contact me
                ]

                select
                - name department
                - [
                  sales
                  tech Tech Support
                  receivables
                ]""");
        return ex;
    }
}
