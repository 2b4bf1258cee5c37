package net.morkit.mordict;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class MorDictWriterTest {

    private static final MorDictParser PARSER = new MorDictParser();

    private static String reformat(String text) throws Exception {
        return MorDictWriter.serialize(PARSER.parse("test.cut", text), true);
    }

    @Test
    void writesBracesAroundCategory() throws Exception {
        assertThat(reformat("cat\t[scat n] =animal= \"a feline\"\n"))
            .isEqualTo("cat\t{[scat n]} =animal= \"a feline\"\n");
    }

    @Test
    void canonicalTextSurvivesUnchanged() throws Exception {
        String text = "% leading\n" +
            "@UTF8\n" +
            "@IPA\n" +
            "% about the header\n" +
            "cat\t{[scat n][num sg]} =animal= \"a feline\"\n" +
            "run\t{[scat v][comp np pp]}\n" +
            "% DISABLED: kat\t{[scat n]} =animal=\n" +
            "% misspelt\n";

        assertThat(reformat(text)).isEqualTo(text);
    }

    @Test
    void rereadingOwnOutputIsStable() throws Exception {
        String once = reformat("cat\n% on the phon\n\t{[scat n]\n" +
                               "% on the pair\n} =animal=\n% trailing\n");

        assertThat(once).isEqualTo("cat % on the phon\n\t{[scat n] " +
            "% on the pair\n} =animal= % trailing\n");
        assertThat(reformat(once)).isEqualTo(once);
    }

    @Test
    void keepsTabAfterCommentedPhon() throws Exception {
        assertThat(reformat("cat\n% c1\n\t{[scat n]}\n"))
            .isEqualTo("cat % c1\n\t{[scat n]}\n");
    }

    @Test
    void emptyPhonStillTakesItsSlot() {
        LexEntry e = new LexEntry(new Phon(""),
            new Cat(new CatAttrVal("scat", "n")), null, null);

        assertThat(MorDictWriter.serialize(e, true))
            .isEqualTo("\t{[scat n]}\n");
    }

    @Test
    void omitsEmptySemanticsAndGloss() throws Exception {
        assertThat(reformat("cat\t{[scat n]} == \"\"\n"))
            .isEqualTo("cat\t{[scat n]}\n");
    }

    @Test
    void keepsCommentsOfOmittedValues() throws Exception {
        assertThat(reformat("cat\t{[scat n]} ==\n% kept\n"))
            .isEqualTo("cat\t{[scat n]} % kept\n");
    }

    @Test
    void dropsCommentsOnRequest() throws Exception {
        Dictionary d = PARSER.parse("test.cut",
            "% leading\ncat\t{[scat n]}\n% about cat\n");

        assertThat(MorDictWriter.serialize(d, false))
            .isEqualTo("cat\t{[scat n]}\n");
    }

    @Test
    void disabledEntriesAreWrittenAsComments() {
        LexEntry e = new LexEntry(new Phon("kat"),
            new Cat(new CatAttrVal("scat", "n")), new Sem("animal"), null);
        e.setEnabled(false);

        assertThat(MorDictWriter.serialize(e, true))
            .isEqualTo("% DISABLED: kat\t{[scat n]} =animal=\n");
    }

    @Test
    void disabledEntriesRoundTripIdempotently() throws Exception {
        String text = "cat\t{[scat n]}\n" +
            "% DISABLED: kat\t{[scat n]} \"cat\"\n" +
            "% DISABLED: katt\t{[scat n]}\n";
        Dictionary first = PARSER.parse("test.cut", text);
        String written = MorDictWriter.serialize(first, true);
        Dictionary second = PARSER.parse("test.cut", written);

        assertThat(written).isEqualTo(text);
        assertThat(second.getEntries()).isEqualTo(first.getEntries());
        assertThat(second.getEntries().get(2).isEnabled()).isFalse();
    }

    @Test
    void disabledEntryWithInnerFieldCommentsRereadsAsComment()
            throws Exception {
        Phon phon = new Phon("cat", null, Arrays.asList(new Comment("pc")));
        LexEntry e = new LexEntry(phon, new Cat(new CatAttrVal("scat", "n")),
                                  new Sem("animal"), null);
        e.setEnabled(false);

        String written = MorDictWriter.serialize(e, true);
        Dictionary reread = PARSER.parse("test.cut", written);

        assertThat(written).isEqualTo(
            "% DISABLED: cat % pc \t{[scat n]} =animal=\n");
        assertThat(reread.getEntries()).isEmpty();
        assertThat(reread.getComments()).extracting(Comment::getValue)
            .containsExactly("DISABLED: cat % pc \t{[scat n]} =animal=");
    }

    @Test
    void writesEmptyCommentsAndValues() {
        Cat cat = new Cat(Arrays.asList(new CatAttrVal("tense", "")));
        LexEntry e = new LexEntry(new Phon("go"), cat, null, null, true,
            null, Arrays.asList(new Comment("")));

        assertThat(MorDictWriter.serialize(e, true))
            .isEqualTo("go\t{[tense]} %\n");
    }

    @Test
    void nodesPrintAsDictionaryText() {
        CatAttrVal av = new CatAttrVal("comp", Arrays.asList("np", "pp"));

        assertThat(av.toString()).isEqualTo("[comp np pp]");
        assertThat(new Cat(av).toString()).isEqualTo("{[comp np pp]}");
    }

}
