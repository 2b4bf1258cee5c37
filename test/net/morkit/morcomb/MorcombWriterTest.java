package net.morkit.morcomb;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class MorcombWriterTest {

    private static final MorcombParser PARSER = new MorcombParser();

    @Test
    void reproducesCanonicalText() throws Exception {
        Annotation a = PARSER.parse("sample.cha", MorcombParserTest.SAMPLE);

        assertThat(MorcombWriter.serialize(a))
            .isEqualTo(MorcombParserTest.SAMPLE);
    }

    @Test
    void normalizesLayout() throws Exception {
        Annotation a = PARSER.parse("loose.cha",
            "\n*CHI:  hi you\n%mor:\tco|hi    pro|you\n\n%comb:\thi\n" +
            "  you\n%penn:\tUH PRP\n%ort:\thi you\n@G:\t7\n");

        assertThat(MorcombWriter.serialize(a)).isEqualTo(
            "*CHI:\thi you\n%mor:\tco|hi\n\tpro|you\n%comb:\thi you\n" +
            "%penn:\tUH PRP\n%ort:\thi you\n@G:\t7\n");
    }

    @Test
    void skipsPaddedCells() {
        Sentence s = Sentence.fromColumns("3", "a b",
            Arrays.asList(new AnalysisCandidates("x|a")),
            Arrays.asList("a", "b"), Arrays.asList("A", "B"),
            Arrays.asList("a", "b"));
        Annotation a = new Annotation();
        a.getSentences().add(s);

        assertThat(MorcombWriter.serialize(a)).isEqualTo(
            "*CHI:\ta b\n%mor:\tx|a\n%comb:\ta b\n%penn:\tA B\n" +
            "%ort:\ta b\n@G:\t3\n");
    }

}
