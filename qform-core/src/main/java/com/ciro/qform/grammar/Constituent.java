package com.ciro.qform.grammar;

import java.util.Objects;

/**
 * Referencia a otra regla dentro de una secuencia, p.ej. {@code "field attribute*"}.
 */
public record Constituent(String ruleName, Quantifier quantifier) {

    public Constituent {
        Objects.requireNonNull(ruleName, "ruleName must not be null");
        Objects.requireNonNull(quantifier, "quantifier must not be null");
        if (ruleName.isBlank()) {
            throw new IllegalArgumentException("Constituent rule name must not be blank");
        }
    }

    /** "value?" -> (value, OPTIONAL). Los nombres pueden llevar espacios ("form field*"). */
    public static Constituent parse(String reference) {
        Objects.requireNonNull(reference, "reference must not be null");
        String ref = reference.trim();
        if (ref.isEmpty()) {
            throw new IllegalArgumentException("Empty constituent reference");
        }
        Quantifier q = Quantifier.fromSuffix(ref.charAt(ref.length() - 1));
        String base = q == Quantifier.ONE ? ref : ref.substring(0, ref.length() - 1).trim();
        return new Constituent(base, q);
    }

    @Override
    public String toString() {
        return ruleName + quantifier.suffix();
    }
}
