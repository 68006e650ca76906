package com.ciro.qform.grammar;

import com.ciro.qform.error.UnknownRuleException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tabla de reglas con nombre más la tabla de handlers semánticos, indexada por nombre de regla.
 * Es inmutable una vez construida: se puede compartir entre hilos sin problema.
 * Toda referencia se valida en {@link Builder#build()}, así que un {@link UnknownRuleException}
 * salta al arrancar y no en mitad de un parse.
 *
 * @param <M> tipo del modelo que acumulan los handlers
 */
public final class Grammar<M> {

    private final String rootName;
    private final Map<String, PartDefinition> definitions;
    private final Map<String, PartHandler<? super M>> handlers;

    private Grammar(Builder<M> b) {
        this.rootName = b.rootName;
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(b.definitions));
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(b.handlers));
    }

    public static <M> Builder<M> builder(String rootName) {
        return new Builder<>(rootName);
    }

    public String rootName() { return rootName; }

    public PartDefinition definition(String name) {
        PartDefinition def = definitions.get(name);
        if (def == null) throw new UnknownRuleException(name);
        return def;
    }

    public boolean defines(String name) {
        return definitions.containsKey(name);
    }

    /** Reglas en orden de declaración. */
    public Collection<PartDefinition> definitions() {
        return definitions.values();
    }

    public Optional<PartHandler<? super M>> handler(String ruleName) {
        return Optional.ofNullable(handlers.get(ruleName));
    }

    public boolean hasHandler(String ruleName) {
        return handlers.containsKey(ruleName);
    }

    public static final class Builder<M> {
        private final String rootName;
        private final Map<String, PartDefinition> definitions = new LinkedHashMap<>();
        private final Map<String, PartHandler<? super M>> handlers = new LinkedHashMap<>();

        private Builder(String rootName) {
            this.rootName = Objects.requireNonNull(rootName, "rootName must not be null");
        }

        public Builder<M> define(PartDefinition definition) {
            Objects.requireNonNull(definition, "definition must not be null");
            if (definitions.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Rule '" + definition.name() + "' is defined twice");
            }
            return this;
        }

        public Builder<M> define(PartDefinition definition, PartHandler<? super M> handler) {
            define(definition);
            return handle(definition.name(), handler);
        }

        public Builder<M> handle(String ruleName, PartHandler<? super M> handler) {
            handlers.put(ruleName, Objects.requireNonNull(handler, "handler must not be null"));
            return this;
        }

        public Grammar<M> build() {
            if (!definitions.containsKey(rootName)) {
                throw new UnknownRuleException(rootName, "<root>");
            }
            for (PartDefinition def : definitions.values()) {
                for (var alt : def.alternatives()) {
                    for (Constituent c : alt) {
                        if (!definitions.containsKey(c.ruleName())) {
                            throw new UnknownRuleException(c.ruleName(), def.name());
                        }
                    }
                }
            }
            for (String ruleName : handlers.keySet()) {
                PartDefinition def = definitions.get(ruleName);
                if (def == null) {
                    throw new UnknownRuleException(ruleName, "<handler>");
                }
                if (def.isTerminal() || def.ignore()) {
                    throw new IllegalStateException("Handler attached to rule '" + ruleName
                            + "' which never produces a composite node");
                }
            }
            return new Grammar<>(this);
        }
    }
}
