package com.ciro.qform.spi;

import com.ciro.qform.error.RenderTypeMismatchException;
import com.ciro.qform.grammar.Grammar;
import com.ciro.qform.grammar.GrammarEngine;

/**
 * Contrato de un dialecto: gramática + modelo + generador de salida.
 * La gramática es de solo lectura; cada parse crea su propio modelo con {@link #newModel()}.
 *
 * @param <M> tipo del acumulador semántico
 */
public interface Dialect<M> {

    DialectInfo info();

    Grammar<M> grammar();

    Class<M> modelType();

    M newModel();

    String render(M model);

    /** Ajustes previos del texto fuente (saltos de línea, etc.). Por defecto no toca nada. */
    default String prepare(String source) {
        return source;
    }

    default M parse(String source) {
        M model = newModel();
        new GrammarEngine<>(grammar()).parse(prepare(source), model);
        return model;
    }

    /**
     * Punto de entrada no tipado (para registros de varios dialectos).
     * Si no recibe el modelo de este dialecto, falla sin emitir nada.
     */
    default String generateOutput(Object model) {
        if (!modelType().isInstance(model)) {
            throw new RenderTypeMismatchException(info().title(), modelType(), model);
        }
        return render(modelType().cast(model));
    }
}
