package com.ciro.qform.error;

/**
 * La gramática referencia una regla que no existe. Es un defecto de configuración,
 * se lanza al construir la gramática, nunca por culpa del texto de entrada.
 */
public class UnknownRuleException extends QFormException {

    private final String ruleName;

    public UnknownRuleException(String ruleName) {
        this(ruleName, null);
    }

    public UnknownRuleException(String ruleName, String referencedBy) {
        super(referencedBy == null
                ? "Unknown grammar rule '" + ruleName + "'"
                : "Unknown grammar rule '" + ruleName + "' referenced by '" + referencedBy + "'");
        this.ruleName = ruleName;
    }

    public String getRuleName() { return ruleName; }
}
