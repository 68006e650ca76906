package com.ciro.qform.grammar;

/**
 * Acción semántica que se ejecuta cuando una regla compuesta encaja por completo.
 * Devolver {@code false} rechaza el match y aborta el parse.
 */
@FunctionalInterface
public interface PartHandler<M> {

    boolean handle(Part part, M model);
}
