package com.ciro.qform.dialect;

import com.ciro.qform.grammar.Part;
import com.ciro.qform.model.Attribute;
import com.ciro.qform.model.Field;
import com.ciro.qform.model.FormModel;

import static com.ciro.qform.dialect.FastFormsGrammar.ARRAY;
import static com.ciro.qform.dialect.FastFormsGrammar.FIELD_ATTRIBUTE;
import static com.ciro.qform.dialect.FastFormsGrammar.FIELD_TYPE;
import static com.ciro.qform.dialect.FastFormsGrammar.NAME;
import static com.ciro.qform.dialect.FastFormsGrammar.OPTION;

/**
 * Handlers semánticos de Fast Forms. Leen el árbol de match y alimentan el {@link FormModel}.
 * Devuelven {@code false} si el nodo no tiene la forma que declara la gramática.
 */
final class FormModelBuilder {

    static final String LABEL = "label";
    static final String ID = "id";
    static final String NAME_ATTR = "name";

    private FormModelBuilder() {}

    /** hyphen(ignorado) name value? newline(ignorado) */
    static boolean onFormAttribute(Part part, FormModel model) {
        if (part.size() == 0 || !part.child(0).is(NAME)) return false;
        String name = part.child(0).value();
        model.addAttribute(new Attribute(name, part.childValue(1, name)));
        return true;
    }

    /** newline? field-type field-attribute* */
    static boolean onFormField(Part part, FormModel model) {
        if (part.size() == 0 || !part.child(0).is(FIELD_TYPE) || part.child(0).size() == 0) return false;

        // El tipo es el primer nieto: field type -> field name
        Field.Builder field = Field.builder(part.child(0).child(0).value());

        for (int i = 1; i < part.size(); i++) {
            Part attr = part.child(i);
            if (!attr.is(FIELD_ATTRIBUTE) || attr.size() == 0) return false;

            Part head = attr.child(0);
            if (head.is(NAME)) {
                String name = head.value();
                String value = attr.childValue(1, name);
                switch (name) {
                    case LABEL -> field.label(value);
                    case ID -> field.id(value).attribute(name, value);
                    case NAME_ATTR -> field.name(value).attribute(name, value);
                    default -> field.attribute(name, value);
                }
            } else if (head.is(ARRAY)) {
                for (Part option : head.children()) {
                    if (!option.is(OPTION) || option.size() == 0) return false;
                    field.option(option.child(0).value(), option.childValue(1, null));
                }
            } else {
                return false;
            }
        }

        model.addField(field.build());
        return true;
    }
}
