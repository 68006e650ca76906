package com.ciro.qform.dialect;

import com.ciro.qform.grammar.Grammar;
import com.ciro.qform.grammar.MatchFormatter;
import com.ciro.qform.model.FormModel;

import static com.ciro.qform.grammar.PartDefinition.composite;
import static com.ciro.qform.grammar.PartDefinition.sequence;
import static com.ciro.qform.grammar.PartDefinition.terminal;

/**
 * Tabla de reglas del lenguaje Fast Forms. Es el contrato del lenguaje:
 * cambiar una forma aquí cambia qué textos se aceptan.
 */
public final class FastFormsGrammar {

    public static final String FORM = "form";
    public static final String FORM_ATTRIBUTE = "form attribute";
    public static final String FORM_FIELD = "form field";
    public static final String FIELD_TYPE = "field type";
    public static final String FIELD_NAME = "field name";
    public static final String FIELD_ATTRIBUTE = "field attribute";
    public static final String ARRAY = "array";
    public static final String ARRAY_OPEN = "array open";
    public static final String ARRAY_CLOSE = "array close";
    public static final String OPTION = "option";
    public static final String NAME = "name";
    public static final String VALUE = "value";
    public static final String HYPHEN = "hyphen";
    public static final String INDENT = "indent";
    public static final String NEWLINE = "newline";

    private FastFormsGrammar() {}

    public static Grammar<FormModel> create() {
        return Grammar.<FormModel>builder(FORM)
            .define(sequence(FORM, FORM_ATTRIBUTE + "*", FORM_FIELD + "*")
                    .describedAs("Composed of zero-or-more attributes and zero-or-more fields."))
            .define(sequence(FORM_ATTRIBUTE, HYPHEN, NAME, VALUE + "?", NEWLINE)
                    .describedAs("Defines attribute of the form tag."),
                    FormModelBuilder::onFormAttribute)
            .define(sequence(FORM_FIELD, NEWLINE + "?", FIELD_TYPE, FIELD_ATTRIBUTE + "*")
                    .describedAs("Composed of optional new-line, field type, and zero-or-more field attributes."),
                    FormModelBuilder::onFormField)
            .define(sequence(FIELD_TYPE, FIELD_NAME, NEWLINE)
                    .describedAs("Line naming the input type."))
            .define(terminal(FIELD_NAME, "[a-zA-Z][a-zA-Z0-9_-]+")
                    .describedAs("Input type tag: text, email, textarea, select, radio, checkbox, submit..."))
            .define(composite(FIELD_ATTRIBUTE,
                        new String[]{HYPHEN, NAME, VALUE + "?", NEWLINE + "?"},
                        new String[]{HYPHEN, ARRAY, NEWLINE + "?"})
                    .describedAs("Either a name/value attribute line or an option array."))
            .define(sequence(ARRAY, ARRAY_OPEN, NEWLINE, OPTION + "*", ARRAY_CLOSE)
                    .describedAs("Bracketed block of indented options."))
            .define(terminal(ARRAY_OPEN, "\\[").ignored())
            .define(terminal(ARRAY_CLOSE, "\\]").ignored())
            .define(sequence(OPTION, INDENT, NAME, VALUE + "?", NEWLINE)
                    .describedAs("Option value with an optional label."))
            // incluye el primer espacio, pero el valor es solo el grupo 1
            .define(terminal(NAME, "([a-zA-Z0-9_.-]+)( )?")
                    .formattedBy(MatchFormatter.group(1))
                    .describedAs("Attribute or option name."))
            .define(terminal(VALUE, "[^\\n]+")
                    .describedAs("Everything up to the end of the line."))
            .define(terminal(HYPHEN, "- ").ignored())
            .define(terminal(INDENT, "  ").ignored())
            .define(terminal(NEWLINE, "\\n").ignored())
            .build();
    }
}
