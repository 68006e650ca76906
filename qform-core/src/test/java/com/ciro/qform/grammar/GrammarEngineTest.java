package com.ciro.qform.grammar;

import com.ciro.qform.error.ParseFailureException;
import com.ciro.qform.error.SemanticRejectionException;
import com.ciro.qform.error.TrailingInputException;
import com.ciro.qform.error.UnknownRuleException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.ciro.qform.grammar.PartDefinition.composite;
import static com.ciro.qform.grammar.PartDefinition.sequence;
import static com.ciro.qform.grammar.PartDefinition.terminal;
import static org.junit.jupiter.api.Assertions.*;

class GrammarEngineTest {

    // (ab,12,cd) -> lista de items separados por comas
    private static Grammar<List<String>> listGrammar(PartHandler<List<String>> onItem) {
        return Grammar.<List<String>>builder("list")
                .define(sequence("list", "open", "item*", "close"))
                .define(terminal("open", "\\(").ignored())
                .define(terminal("close", "\\)").ignored())
                .define(composite("item",
                        new String[]{"word", "sep?"},
                        new String[]{"number", "sep?"}), onItem)
                .define(terminal("word", "[a-z]+"))
                .define(terminal("number", "[0-9]+"))
                .define(terminal("sep", ",").ignored())
                .build();
    }

    private static final PartHandler<List<String>> RECORD =
            (p, m) -> m.add(p.child(0).name() + ":" + p.child(0).value());

    @Test
    void orderedAlternativesAndRepetitionBuildTheTree() {
        List<String> seen = new ArrayList<>();
        Part root = new GrammarEngine<>(listGrammar(RECORD)).parse("(ab,12,cd)", seen);

        assertEquals("list", root.name());
        assertEquals(3, root.size(), "ignored punctuation must not show up as children");
        assertEquals("item", root.child(1).name());
        assertEquals("number", root.child(1).child(0).name());
        assertEquals("12", root.child(1).child(0).value());
        assertNull(root.value());
        assertEquals(List.of("word:ab", "number:12", "word:cd"), seen);
    }

    @Test
    void zeroRepetitionsIsValid() {
        List<String> seen = new ArrayList<>();
        Part root = new GrammarEngine<>(listGrammar(RECORD)).parse("()", seen);
        assertEquals(0, root.size());
        assertTrue(seen.isEmpty());
    }

    @Test
    void failedAlternativeRollsBackNodesAndActions() {
        List<String> seen = new ArrayList<>();
        Grammar<List<String>> g = Grammar.<List<String>>builder("choice")
                .define(composite("choice",
                        new String[]{"pair", "bang"},
                        new String[]{"pair", "dot"}))
                .define(sequence("pair", "word", "space", "word"), (p, m) -> m.add("pair"))
                .define(terminal("word", "[a-z]+"))
                .define(terminal("space", " ").ignored())
                .define(terminal("bang", "!"))
                .define(terminal("dot", "\\."))
                .build();

        Part root = new GrammarEngine<>(g).parse("ab cd.", seen);

        assertEquals(List.of("pair"), seen, "the pair matched by the abandoned alternative must not fire");
        assertEquals(2, root.size());
        assertEquals("dot", root.child(1).name());
        assertEquals("cd", root.child(0).child(1).value());
    }

    @Test
    void rootThatDoesNotMatchReportsFurthestFailure() {
        ParseFailureException e = assertThrows(ParseFailureException.class,
                () -> new GrammarEngine<>(listGrammar(RECORD)).parse("(ab", new ArrayList<>()));

        assertFalse(e instanceof TrailingInputException);
        assertEquals("list", e.getRuleName());
        assertEquals(3, e.getOffset());
        assertEquals(1, e.getLine());
        assertEquals(4, e.getColumn());
        assertTrue(e.getExpected().contains("close"), e.getExpected().toString());
    }

    @Test
    void trailingGarbageIsAnErrorButTrailingWhitespaceIsNot() {
        GrammarEngine<List<String>> engine = new GrammarEngine<>(listGrammar(RECORD));

        assertDoesNotThrow(() -> engine.parse("(ab)\n  \n", new ArrayList<>()));

        TrailingInputException e = assertThrows(TrailingInputException.class,
                () -> engine.parse("(ab)\n  zz", new ArrayList<>()));
        assertEquals(7, e.getOffset());
        assertEquals(2, e.getLine());
        assertEquals(3, e.getColumn());
    }

    @Test
    void actionsDoNotRunWhenTheParseFails() {
        List<String> seen = new ArrayList<>();
        GrammarEngine<List<String>> engine = new GrammarEngine<>(listGrammar(RECORD));

        assertThrows(TrailingInputException.class, () -> engine.parse("(ab) junk", seen));
        assertTrue(seen.isEmpty());
    }

    @Test
    void rejectedMatchAbortsTheParse() {
        GrammarEngine<List<String>> engine = new GrammarEngine<>(listGrammar((p, m) -> !"bad".equals(p.child(0).value())));

        SemanticRejectionException e = assertThrows(SemanticRejectionException.class,
                () -> engine.parse("(ok,bad)", new ArrayList<>()));
        assertEquals("item", e.getRuleName());
    }

    @Test
    void handlerExceptionsBecomeSemanticRejections() {
        GrammarEngine<List<String>> engine = new GrammarEngine<>(listGrammar((p, m) -> {
            throw new IllegalStateException("boom");
        }));

        SemanticRejectionException e = assertThrows(SemanticRejectionException.class,
                () -> engine.parse("(ab)", new ArrayList<>()));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void matchSingleRuleAtPosition() {
        GrammarEngine<List<String>> engine = new GrammarEngine<>(listGrammar(RECORD));

        Optional<Match> word = engine.match("word", "12 ab", 3);
        assertTrue(word.isPresent());
        assertEquals("ab", word.get().part().value());
        assertEquals(5, word.get().end());

        Match sep = engine.match("sep", "x,", 1).orElseThrow();
        assertTrue(sep.isSkipped());
        assertEquals(1, sep.length());

        assertTrue(engine.match("number", "ab", 0).isEmpty());
        assertThrows(UnknownRuleException.class, () -> engine.match("nope", "ab", 0));
    }

    @Test
    void formatterSelectsTheCapturedGroup() {
        Grammar<List<String>> g = Grammar.<List<String>>builder("name")
                .define(terminal("name", "([a-z]+)( )?").formattedBy(MatchFormatter.group(1)))
                .build();

        Match m = new GrammarEngine<>(g).match("name", "maxlength 30", 0).orElseThrow();
        assertEquals("maxlength", m.part().value());
        assertEquals(10, m.end(), "the trailing space is consumed even though it is not part of the value");
    }

    @Test
    void emptyRepetitionDoesNotLoopForever() {
        Grammar<List<String>> g = Grammar.<List<String>>builder("loop")
                .define(sequence("loop", "maybe*"))
                .define(terminal("maybe", "a*"))
                .build();
        GrammarEngine<List<String>> engine = new GrammarEngine<>(g);

        assertEquals(1, engine.parse("", new ArrayList<>()).size());
        assertEquals("aaa", engine.parse("aaa", new ArrayList<>()).child(0).value());
    }

    @Test
    void unknownReferencesFailWhenTheGrammarIsBuilt() {
        UnknownRuleException e = assertThrows(UnknownRuleException.class,
                () -> Grammar.builder("root").define(sequence("root", "missing?")).build());
        assertEquals("missing", e.getRuleName());

        assertThrows(UnknownRuleException.class,
                () -> Grammar.builder("root").define(terminal("other", "x")).build());
    }

    @Test
    void handlersOnlyAttachToCompositeRules() {
        assertThrows(IllegalStateException.class, () -> Grammar.<List<String>>builder("t")
                .define(terminal("t", "x"), (p, m) -> true)
                .build());
    }

    @Test
    void duplicateRuleNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Grammar.builder("t")
                .define(terminal("t", "x"))
                .define(terminal("t", "y")));
    }

    @Test
    void partRendersAsReadableTree() {
        Part root = new GrammarEngine<>(listGrammar((p, m) -> true)).parse("(ab,1)", new ArrayList<>());
        assertEquals("list(item(word\"ab\"), item(number\"1\"))", root.toString());
    }
}
