package net.morkit.morcomb;

import java.util.List;
import net.morkit.api.parser.Mapper;
import net.morkit.api.parser.Mappers;
import net.morkit.api.parser.MappingException;
import net.morkit.api.parser.RecordMapper;
import net.morkit.api.parser.TransformMapper;

/**
 * Converts parse trees of MorcombGrammar into Annotation-s.
 */
public final class MorcombMapper {

    /** Maps a node with an optional text token to its (trimmed) text. */
    public static final Mapper<String> OPTIONAL_TEXT =
        new TransformMapper<String, String>(
                Mappers.unwrapOr(Mappers.content(), "")) {
            protected String transform(String value) {
                return value.trim();
            }
        };

    public static final Mapper<List<String>> STRINGS =
        Mappers.aggregate(Mappers.content());

    public static final Mapper<AnalysisCandidates> CANDIDATES =
        new TransformMapper<List<String>, AnalysisCandidates>(STRINGS) {
            protected AnalysisCandidates transform(List<String> alts)
                    throws MappingException {
                if (alts.isEmpty())
                    throw new MappingException("Empty candidate list");
                return new AnalysisCandidates(alts);
            }
        };

    public static final Mapper<List<AnalysisCandidates>> MOR_ROW =
        Mappers.aggregate(CANDIDATES);

    public static final Mapper<Sentence> SENTENCE =
        new RecordMapper<Sentence>() {
            protected Sentence mapInner(Provider p) throws MappingException {
                String chi = p.mapNext(OPTIONAL_TEXT);
                List<AnalysisCandidates> mor = p.mapNext(MOR_ROW);
                List<String> comb = p.mapNext(STRINGS);
                List<String> penn = p.mapNext(STRINGS);
                List<String> ort = p.mapNext(STRINGS);
                String id = p.mapNext(OPTIONAL_TEXT);
                return Sentence.fromColumns(id, chi, mor, comb, penn, ort);
            }
        };

    public static final Mapper<List<String>> AMBLES =
        Mappers.aggregate(OPTIONAL_TEXT);

    public static final Mapper<Annotation> DOCUMENT =
        new RecordMapper<Annotation>() {
            protected Annotation mapInner(Provider p) throws MappingException {
                Annotation ret = new Annotation();
                ret.getPreambles().addAll(p.mapNext(AMBLES));
                ret.getSentences().addAll(p.mapNext(
                    Mappers.aggregate(SENTENCE)));
                ret.getPostambles().addAll(p.mapNext(AMBLES));
                return ret;
            }
        };

    /** Maps the tree returned by the parser (rooted at the start symbol). */
    public static final Mapper<Annotation> FILE = Mappers.unwrap(DOCUMENT);

    /* Prevent construction */
    private MorcombMapper() {}

}
