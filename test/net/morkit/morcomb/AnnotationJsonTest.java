package net.morkit.morcomb;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import org.json.JSONException;
import org.junit.jupiter.api.Test;

class AnnotationJsonTest {

    private static Annotation sample() {
        Annotation a = new Annotation();
        a.getPreambles().add("Begin");
        a.getSentences().add(new Sentence("s1", "the cat", Arrays.asList(
            new Word(new AnalysisCandidates("det|the"), "the", "DT", "the"),
            new Word(new AnalysisCandidates("n|cat", "v|cat"), "cat", "NN",
                     "cat"))));
        return a;
    }

    @Test
    void keepsUnambiguousCandidatesOnOneLine() {
        assertThat(AnnotationJson.encode(sample())).isEqualTo(
            "{\n" +
            "  \"preambles\": [\n" +
            "    \"Begin\"\n" +
            "  ],\n" +
            "  \"contents\": [\n" +
            "    {\n" +
            "      \"ID\": \"s1\",\n" +
            "      \"CHI\": \"the cat\",\n" +
            "      \"Words\": [\n" +
            "        {\n" +
            "          \"SynCat\": \"DT\",\n" +
            "          \"Orthography\": \"the\",\n" +
            "          \"Phon\": \"the\",\n" +
            "          \"Mors\": [\"det|the\"]\n" +
            "        },\n" +
            "        {\n" +
            "          \"SynCat\": \"NN\",\n" +
            "          \"Orthography\": \"cat\",\n" +
            "          \"Phon\": \"cat\",\n" +
            "          \"Mors\": [\n" +
            "            \"n|cat\",\n" +
            "            \"v|cat\"\n" +
            "          ]\n" +
            "        }\n" +
            "      ]\n" +
            "    }\n" +
            "  ],\n" +
            "  \"postambles\": []\n" +
            "}\n");
    }

    @Test
    void decodesWhatItEncodes() throws JSONException {
        Annotation a = sample();
        a.getSentences().add(Sentence.fromColumns("s2", "\"quoted\"",
            Arrays.asList(new AnalysisCandidates("n|x")),
            Arrays.asList("x", "y"), Arrays.asList("N"),
            Arrays.<String>asList()));

        Annotation back = AnnotationJson.decode(AnnotationJson.encode(a));

        assertThat(back.getPreambles()).isEqualTo(a.getPreambles());
        assertThat(back.getSentences()).isEqualTo(a.getSentences());
        assertThat(back.getSentences().get(1).getWords().get(1)
                   .getCandidates()).isNull();
        assertThat(back.getPostambles()).isEmpty();
    }

    @Test
    void decodesCompactInput() throws JSONException {
        Annotation a = AnnotationJson.decode("{\"preambles\": [], " +
            "\"contents\": [{\"ID\": \"1\", \"CHI\": \"hi\", \"Words\": " +
            "[{\"SynCat\": \"UH\", \"Orthography\": \"hi\", \"Phon\": " +
            "\"hi\", \"Mors\": [\"co|hi\"]}]}], \"postambles\": [\"End\"]}");

        assertThat(a.getSentences().get(0).getWords().get(0)
                   .getCandidates()).isEqualTo(new AnalysisCandidates("co|hi"));
        assertThat(a.getPostambles()).containsExactly("End");
    }

    @Test
    void rejectsTrailingGarbage() {
        assertThatThrownBy(() -> AnnotationJson.parseOneValue("{} {}"))
            .isInstanceOf(JSONException.class)
            .hasMessageContaining("garbage");
    }

    @Test
    void rejectsEmptyCandidateLists() {
        assertThatThrownBy(() -> AnnotationJson.decodeCandidates(
                AnnotationJson.parseOneValue("[]")))
            .isInstanceOf(JSONException.class);
    }

}
