package net.morkit.mordict;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import net.morkit.api.parser.ParsingException;
import org.junit.jupiter.api.Test;

class MorDictParserTest {

    private static final MorDictParser PARSER = new MorDictParser();

    private static List<String> values(List<Comment> comments) {
        List<String> ret = new ArrayList<String>();
        for (Comment c : comments) ret.add(c.getValue());
        return ret;
    }

    @Test
    void parsesEntryWithoutBraces() throws Exception {
        Dictionary d = PARSER.parse("test.cut",
            "cat\t[scat n] =animal= \"a feline\"\n");

        assertThat(d.getName()).isEqualTo("test.cut");
        assertThat(d.getEntries()).hasSize(1);
        LexEntry e = d.getEntries().get(0);
        assertThat(e.getPhon().getValue()).isEqualTo("cat");
        assertThat(e.getCat().getAttrVals()).containsExactly(
            new CatAttrVal("scat", "n"));
        assertThat(e.getSem().getValue()).isEqualTo("animal");
        assertThat(e.getGloss().getValue()).isEqualTo("a feline");
        assertThat(e.isEnabled()).isTrue();
    }

    @Test
    void recordsPositions() throws Exception {
        Dictionary d = PARSER.parse("test.cut",
            "@UTF8\ncat {[scat n]}\n  dog {[scat n]}\n");

        LexEntry dog = d.getEntries().get(1);
        assertThat(dog.getPosition().getLine()).isEqualTo(3);
        assertThat(dog.getPosition().getColumn()).isEqualTo(3);
        assertThat(dog.getCat().getPosition().getColumn()).isEqualTo(7);
    }

    @Test
    void parsesMultiValuedPairsAndEmptyValues() throws Exception {
        LexEntry e = PARSER.parse("test.cut",
            "run\t{[scat v] [comp np pp] [tense]}\n")
            .getEntries().get(0);

        Cat cat = e.getCat();
        assertThat(cat.count("comp")).isEqualTo(1);
        assertThat(cat.valuesOf("comp")).containsExactly(
            Arrays.asList("np", "pp"));
        assertThat(cat.valuesOf("tense")).containsExactly(
            Collections.singletonList(""));
        assertThat(e.getSem().isEmpty()).isTrue();
        assertThat(e.getGloss().isEmpty()).isTrue();
    }

    @Test
    void anchorsCommentsToPrecedingItem() throws Exception {
        Dictionary d = PARSER.parse("test.cut",
            "% first\n% second\n" +
            "@UTF8\n% about the header\n" +
            "cat\n% on the phon\n\t{[scat n]} =animal=\n" +
            "% one\n% two\n% three\n" +
            "dog\t{[scat n]\n% on the pair\n}\n");

        assertThat(values(d.getComments()))
            .containsExactly("first", "second");
        assertThat(values(d.getPreambles().get(0).getComments()))
            .containsExactly("about the header");
        LexEntry cat = d.getEntries().get(0);
        assertThat(values(cat.getPhon().getComments()))
            .containsExactly("on the phon");
        assertThat(values(cat.getSem().getComments()))
            .containsExactly("one", "two", "three");
        LexEntry dog = d.getEntries().get(1);
        assertThat(values(dog.getCat().getAttrVals().get(0).getComments()))
            .containsExactly("on the pair");
        assertThat(dog.getCat().getComments()).isEmpty();
    }

    @Test
    void bracelessCategoryTakesCommentsOfItsLastPair() throws Exception {
        LexEntry e = PARSER.parse("test.cut",
            "cat\t[scat n] [num sg]\n% note\n").getEntries().get(0);

        assertThat(values(e.getCat().getComments())).containsExactly("note");
        assertThat(e.getCat().getAttrVals().get(1).getComments()).isEmpty();
    }

    @Test
    void readsDisabledEntriesFromComments() throws Exception {
        Dictionary d = PARSER.parse("test.cut",
            "cat\t{[scat n]} =animal=\n" +
            "% DISABLED: kat\t{[scat n]} =animal=\n" +
            "% spelling\n" +
            "% DISABLED: not an entry\n");

        assertThat(d.getEntries()).hasSize(2);
        LexEntry cat = d.getEntries().get(0);
        assertThat(cat.isEnabled()).isTrue();
        assertThat(cat.getSem().getComments()).isEmpty();
        LexEntry kat = d.getEntries().get(1);
        assertThat(kat.isEnabled()).isFalse();
        assertThat(kat.getPhon().getValue()).isEqualTo("kat");
        assertThat(kat.getPosition().getLine()).isEqualTo(2);
        assertThat(kat.getPosition().getColumn()).isEqualTo(13);
        assertThat(values(kat.getComments())).containsExactly(
            "spelling", "DISABLED: not an entry");
    }

    @Test
    void readsDisabledEntriesInHeader() throws Exception {
        Dictionary d = PARSER.parse("test.cut",
            "% intro\n% DISABLED: kat\t{[scat n]}\n% why\n" +
            "cat\t{[scat n]}\n");

        assertThat(values(d.getComments())).containsExactly("intro");
        assertThat(d.getEntries()).hasSize(2);
        assertThat(d.getEntries().get(0).isEnabled()).isFalse();
        assertThat(values(d.getEntries().get(0).getComments()))
            .containsExactly("why");
        assertThat(d.getEntries().get(1).isEnabled()).isTrue();
    }

    @Test
    void acceptsEmptyInput() throws Exception {
        Dictionary d = PARSER.parse(null, "\n\n");

        assertThat(d.getEntries()).isEmpty();
        assertThat(d.getName()).matches("<UNTITLED>[0-9A-F]{7}");
    }

    @Test
    void reportsMissingClosingBrace() {
        assertThatThrownBy(() -> PARSER.parse("test.cut",
                                              "cat\t{[scat n]\n"))
            .isInstanceOf(ParsingException.class)
            .hasMessage("test.cut:2:1: Unexpected end of input, expected " +
                        "any of EndOfLine, \"%\", \"[\", \"}\"")
            .satisfies(exc -> assertThat(
                ((ParsingException) exc).getExpected()).contains("\"}\""));
    }

    @Test
    void parseEntryRejectsMoreThanOneEntry() {
        assertThatThrownBy(() -> PARSER.parseEntry("test.cut",
                "a {[scat n]} b {[scat n]}", null))
            .isInstanceOf(ParsingException.class)
            .hasMessageContaining("Expected exactly one entry");
    }

    @Test
    void checkValidatesWithoutBuildingAModel() throws Exception {
        PARSER.check("ok.cut", "cat\t{[scat n]}\n");
        assertThatThrownBy(() -> PARSER.check("bad.cut", "cat\t{[scat n]\n"))
            .isInstanceOf(ParsingException.class)
            .hasMessageStartingWith("bad.cut:2:1: Unexpected end of input");
    }

    @Test
    void logsOneSummaryPerDocument() throws Exception {
        final List<String> messages = new ArrayList<String>();
        Handler capture = new Handler() {
            public void publish(LogRecord record) {
                messages.add(record.getMessage());
            }
            public void flush() {}
            public void close() {}
        };
        Logger logger = Logger.getLogger("MorDictParser");
        Level saved = logger.getLevel();
        logger.setLevel(Level.FINE);
        logger.addHandler(capture);
        try {
            PARSER.parse("test.cut", "cat\t{[scat n]}\n" +
                "% DISABLED: kat\t{[scat n]}\n" +
                "% DISABLED: katt\t{[scat n]}\n");
        } finally {
            logger.removeHandler(capture);
            logger.setLevel(saved);
        }

        assertThat(messages).containsExactly(
            "Parsed dictionary test.cut with 0 preambles and 3 entries");
    }

}
