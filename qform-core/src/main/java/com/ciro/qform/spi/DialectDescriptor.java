package com.ciro.qform.spi;

import com.ciro.qform.error.QFormException;
import com.ciro.qform.grammar.Constituent;
import com.ciro.qform.grammar.Grammar;
import com.ciro.qform.grammar.PartDefinition;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Vista serializable de un dialecto: metadatos + todas las reglas, en orden de declaración.
 * Pensada para tooling (documentación, editores, autocompletado).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DialectDescriptor(String title,
                                String description,
                                String root,
                                String version,
                                Map<String, String> examples,
                                List<Rule> rules) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Rule(String name,
                       String description,
                       PartDefinition.Kind kind,
                       List<String> alternatives,
                       String pattern,
                       boolean ignore,
                       boolean handled) {}

    private static final ObjectMapper MAPPER = ObjectMapperFactory.create();

    public static DialectDescriptor describe(Dialect<?> dialect) {
        DialectInfo info = dialect.info();
        Grammar<?> grammar = dialect.grammar();

        List<Rule> rules = new ArrayList<>();
        for (PartDefinition def : grammar.definitions()) {
            List<String> alts = def.isTerminal() ? null : def.alternatives().stream()
                    .map(seq -> seq.stream().map(Constituent::toString).collect(Collectors.joining(", ")))
                    .toList();
            rules.add(new Rule(
                    def.name(),
                    def.description().isEmpty() ? null : def.description(),
                    def.kind(),
                    alts,
                    def.isTerminal() ? def.pattern().pattern() : null,
                    def.ignore(),
                    grammar.hasHandler(def.name())));
        }
        return new DialectDescriptor(info.title(), info.description(), grammar.rootName(),
                info.version(), info.examples(), List.copyOf(rules));
    }

    public static String toJson(Dialect<?> dialect) {
        try {
            return MAPPER.writeValueAsString(describe(dialect));
        } catch (JsonProcessingException e) {
            throw new QFormException("Cannot serialise dialect '" + dialect.info().title() + "'", e);
        }
    }
}
