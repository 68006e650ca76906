package com.ciro.qform.grammar;

/**
 * Offset convertido a línea/columna (ambas base 1) para los mensajes de error.
 */
public record TextPosition(int offset, int line, int column) {

    public static TextPosition of(String source, int offset) {
        int line = 1;
        int lineStart = 0;
        int limit = Math.min(offset, source.length());
        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new TextPosition(offset, line, offset - lineStart + 1);
    }
}
