package com.ciro.qform.grammar;

/**
 * Resultado positivo de {@link GrammarEngine#match}. Un terminal ignorado avanza la
 * posición pero no produce nodo: en ese caso {@code part} es {@code null}.
 */
public record Match(Part part, int start, int end) {

    public boolean isSkipped() {
        return part == null;
    }

    public int length() {
        return end - start;
    }
}
