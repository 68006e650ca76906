package com.ciro.qform.grammar;

import com.ciro.qform.error.ParseFailureException;
import com.ciro.qform.error.QFormException;
import com.ciro.qform.error.SemanticRejectionException;
import com.ciro.qform.error.TrailingInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Matcher descendente recursivo que interpreta una {@link Grammar}.
 * <ul>
 *   <li>Alternativas con elección ordenada: gana la primera que encaja (estilo PEG).</li>
 *   <li>Constituyentes con '?' y '*': un fallo no es error, solo backtracking local.</li>
 *   <li>Terminales: regex anclada en la posición actual.</li>
 * </ul>
 * El motor no guarda estado entre llamadas; cada parse tiene su arena y su journal de acciones.
 */
public final class GrammarEngine<M> {

    private static final Logger log = LoggerFactory.getLogger(GrammarEngine.class);

    private static final int NO_NODE = -1;

    private final Grammar<M> grammar;

    public GrammarEngine(Grammar<M> grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
    }

    public Grammar<M> grammar() {
        return grammar;
    }

    /**
     * Intenta una sola regla en {@code position}. No ejecuta handlers ni exige consumir todo.
     */
    public Optional<Match> match(String ruleName, String source, int position) {
        Objects.requireNonNull(source, "source must not be null");
        if (position < 0 || position > source.length()) {
            throw new IndexOutOfBoundsException("Position " + position + " outside source of length " + source.length());
        }
        Run run = new Run(source);
        Step step = run.match(ruleName, position);
        if (step == null) return Optional.empty();
        Part part = step.node == NO_NODE ? null : run.arena.part(step.node);
        return Optional.of(new Match(part, position, step.position));
    }

    /**
     * Parse completo desde la regla raíz. Si el texto encaja entero, ejecuta los handlers
     * (en el orden en que se completaron las reglas) contra {@code model} y devuelve la raíz.
     *
     * @throws ParseFailureException     si la raíz no encaja
     * @throws TrailingInputException    si queda texto no-blanco sin consumir
     * @throws SemanticRejectionException si un handler rechaza su match
     */
    public Part parse(String source, M model) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(model, "model must not be null");

        Run run = new Run(source);
        String root = grammar.rootName();
        Step step = run.match(root, 0);

        if (step == null) {
            TextPosition at = TextPosition.of(source, run.furthest);
            throw new ParseFailureException(root, at.offset(), at.line(), at.column(), run.expectedAtFurthest());
        }

        int rest = firstNonWhitespace(source, step.position);
        if (rest < source.length()) {
            TextPosition at = TextPosition.of(source, rest);
            List<String> expected = run.furthest >= step.position ? run.expectedAtFurthest() : List.of();
            throw new TrailingInputException(root, at.offset(), at.line(), at.column(), expected);
        }

        for (int node : run.journal) {
            Part part = run.arena.part(node);
            PartHandler<? super M> handler = grammar.handler(part.name()).orElseThrow();
            boolean accepted;
            try {
                accepted = handler.handle(part, model);
            } catch (QFormException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new SemanticRejectionException(part.name(), e);
            }
            if (!accepted) {
                throw new SemanticRejectionException(part.name());
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Parsed {} chars with root '{}': {} nodes, {} semantic actions",
                    source.length(), root, run.arena.size(), run.journal.size());
        }
        return run.arena.part(step.node);
    }

    private static int firstNonWhitespace(String source, int from) {
        int i = from;
        while (i < source.length() && Character.isWhitespace(source.charAt(i))) i++;
        return i;
    }

    private record Step(int position, int node) {}

    /** Estado de un único parse: arena de nodos, journal de handlers y el fallo más lejano. */
    private final class Run {
        final String source;
        final PartArena arena = new PartArena();
        final List<Integer> journal = new ArrayList<>();

        int furthest = 0;
        final Set<String> expected = new LinkedHashSet<>();

        Run(String source) {
            this.source = source;
        }

        Step match(String ruleName, int pos) {
            PartDefinition def = grammar.definition(ruleName);
            Step step = def.isTerminal() ? matchTerminal(def, pos) : matchComposite(def, pos);
            if (log.isTraceEnabled()) {
                log.trace("{} '{}' at {}", step == null ? "miss" : "hit ", ruleName,
                        step == null ? pos : pos + ".." + step.position);
            }
            return step;
        }

        private Step matchTerminal(PartDefinition def, int pos) {
            Matcher m = def.pattern().matcher(source);
            m.region(pos, source.length());
            if (!m.lookingAt()) {
                recordFailure(def.name(), pos);
                return null;
            }
            if (def.ignore()) {
                return new Step(m.end(), NO_NODE);
            }
            String value = def.formatter() != null ? def.formatter().format(m) : m.group();
            return new Step(m.end(), arena.add(def.name(), value, PartArena.NO_CHILDREN));
        }

        private Step matchComposite(PartDefinition def, int pos) {
            for (List<Constituent> alternative : def.alternatives()) {
                int arenaMark = arena.mark();
                int journalMark = journal.size();

                List<Integer> children = new ArrayList<>();
                int end = matchSequence(alternative, pos, children);
                if (end >= 0) {
                    if (def.ignore()) {
                        return new Step(end, NO_NODE);
                    }
                    int node = arena.add(def.name(), null, toArray(children));
                    if (grammar.hasHandler(def.name())) {
                        journal.add(node);
                    }
                    return new Step(end, node);
                }

                // Alternativa fallida: se tira todo lo que construyó
                arena.rollback(arenaMark);
                truncate(journal, journalMark);
            }
            return null;
        }

        /** Devuelve la posición final o -1 si la secuencia no encaja. */
        private int matchSequence(List<Constituent> sequence, int pos, List<Integer> children) {
            int cursor = pos;
            for (Constituent c : sequence) {
                switch (c.quantifier()) {
                    case ONE -> {
                        Step s = match(c.ruleName(), cursor);
                        if (s == null) return -1;
                        cursor = collect(s, children);
                    }
                    case OPTIONAL -> {
                        Step s = match(c.ruleName(), cursor);
                        if (s != null) cursor = collect(s, children);
                    }
                    case ZERO_OR_MORE -> {
                        while (true) {
                            Step s = match(c.ruleName(), cursor);
                            if (s == null) break;
                            int before = cursor;
                            cursor = collect(s, children);
                            // Un match vacío repetido sería un bucle infinito
                            if (cursor == before) break;
                        }
                    }
                }
            }
            return cursor;
        }

        private int collect(Step s, List<Integer> children) {
            if (s.node != NO_NODE) children.add(s.node);
            return s.position;
        }

        private void recordFailure(String ruleName, int pos) {
            if (pos > furthest) {
                furthest = pos;
                expected.clear();
            }
            if (pos == furthest) {
                expected.add(ruleName);
            }
        }

        List<String> expectedAtFurthest() {
            return List.copyOf(expected);
        }
    }

    private static int[] toArray(List<Integer> list) {
        if (list.isEmpty()) return PartArena.NO_CHILDREN;
        int[] out = new int[list.size()];
        for (int i = 0; i < out.length; i++) out[i] = list.get(i);
        return out;
    }

    private static void truncate(List<Integer> list, int size) {
        while (list.size() > size) list.remove(list.size() - 1);
    }
}
