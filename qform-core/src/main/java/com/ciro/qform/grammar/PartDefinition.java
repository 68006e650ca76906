package com.ciro.qform.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Definición inmutable de una regla de gramática.
 * <p>
 * Una regla es o bien un terminal (regex anclada en la posición actual) o bien
 * una composición de alternativas ordenadas; nunca las dos cosas.
 * El handler semántico no vive aquí: la {@link Grammar} lo resuelve por nombre.
 */
public record PartDefinition(String name,
                             String description,
                             Kind kind,
                             List<List<Constituent>> alternatives,
                             Pattern pattern,
                             MatchFormatter formatter,
                             boolean ignore) {

    public enum Kind {
        TERMINAL,
        COMPOSITE
    }

    public PartDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        description = description == null ? "" : description;
        if (kind == Kind.TERMINAL) {
            Objects.requireNonNull(pattern, "terminal '" + name + "' needs a pattern");
            alternatives = List.of();
        } else {
            if (pattern != null || formatter != null) {
                throw new IllegalArgumentException("Composite rule '" + name + "' cannot declare a pattern");
            }
            if (alternatives == null || alternatives.isEmpty()) {
                throw new IllegalArgumentException("Composite rule '" + name + "' needs at least one alternative");
            }
            List<List<Constituent>> copy = new ArrayList<>(alternatives.size());
            for (List<Constituent> alt : alternatives) {
                if (alt.isEmpty()) {
                    throw new IllegalArgumentException("Composite rule '" + name + "' has an empty alternative");
                }
                copy.add(List.copyOf(alt));
            }
            alternatives = List.copyOf(copy);
        }
    }

    public static PartDefinition terminal(String name, String regex) {
        return new PartDefinition(name, "", Kind.TERMINAL, null, Pattern.compile(regex), null, false);
    }

    /**
     * Cada array es una alternativa; cada string un constituyente con sufijo opcional.
     * <pre>composite("field attribute", new String[]{"hyphen", "name", "value?"}, new String[]{"hyphen", "array"})</pre>
     */
    public static PartDefinition composite(String name, String[]... alternatives) {
        List<List<Constituent>> alts = new ArrayList<>(alternatives.length);
        for (String[] alt : alternatives) {
            List<Constituent> seq = new ArrayList<>(alt.length);
            for (String ref : alt) seq.add(Constituent.parse(ref));
            alts.add(seq);
        }
        return new PartDefinition(name, "", Kind.COMPOSITE, alts, null, null, false);
    }

    public static PartDefinition sequence(String name, String... constituents) {
        return composite(name, new String[][]{constituents});
    }

    public PartDefinition describedAs(String text) {
        return new PartDefinition(name, text, kind, alternatives, pattern, formatter, ignore);
    }

    public PartDefinition ignored() {
        return new PartDefinition(name, description, kind, alternatives, pattern, formatter, true);
    }

    public PartDefinition formattedBy(MatchFormatter fmt) {
        if (kind != Kind.TERMINAL) {
            throw new IllegalStateException("Only terminals can format their match: " + name);
        }
        return new PartDefinition(name, description, kind, alternatives, pattern, fmt, ignore);
    }

    public boolean isTerminal() { return kind == Kind.TERMINAL; }
}
