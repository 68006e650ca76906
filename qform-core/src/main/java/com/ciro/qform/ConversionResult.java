package com.ciro.qform;

import com.ciro.qform.error.QFormException;

/**
 * Resultado tipado de una conversión: o bien salida, o bien error. Nunca ambos.
 */
public record ConversionResult(String output, QFormException error) {

    public ConversionResult {
        if ((output == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of output or error must be set");
        }
    }

    public static ConversionResult success(String output) {
        return new ConversionResult(output, null);
    }

    public static ConversionResult failure(QFormException error) {
        return new ConversionResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String orElseThrow() {
        if (error != null) throw error;
        return output;
    }
}
