package com.ciro.qform.grammar;

/**
 * Sufijo de cantidad de un constituyente: nada (exactamente uno), '?' (cero o uno), '*' (cero o más).
 */
public enum Quantifier {
    ONE(""),
    OPTIONAL("?"),
    ZERO_OR_MORE("*");

    private final String suffix;

    Quantifier(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() { return suffix; }

    public boolean isRequired() { return this == ONE; }

    static Quantifier fromSuffix(char c) {
        return switch (c) {
            case '?' -> OPTIONAL;
            case '*' -> ZERO_OR_MORE;
            default -> ONE;
        };
    }
}
