package com.ciro.qform.error;

/**
 * Raíz de todos los errores del motor QForm.
 * Son unchecked: el llamador decide si los convierte en resultado o los deja subir.
 */
public class QFormException extends RuntimeException {

    public QFormException(String message) {
        super(message);
    }

    public QFormException(String message, Throwable cause) {
        super(message, cause);
    }
}
