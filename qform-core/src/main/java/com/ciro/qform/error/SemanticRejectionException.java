package com.ciro.qform.error;

/**
 * Un handler semántico rechazó un match que era sintácticamente válido. Aborta el parse.
 */
public class SemanticRejectionException extends QFormException {

    private final String ruleName;

    public SemanticRejectionException(String ruleName) {
        super("Semantic handler of rule '" + ruleName + "' rejected the match");
        this.ruleName = ruleName;
    }

    public SemanticRejectionException(String ruleName, Throwable cause) {
        super("Semantic handler of rule '" + ruleName + "' failed: " + cause.getMessage(), cause);
        this.ruleName = ruleName;
    }

    public String getRuleName() { return ruleName; }
}
