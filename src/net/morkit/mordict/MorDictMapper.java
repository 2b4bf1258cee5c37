package net.morkit.mordict;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.morkit.api.parser.LocatedParserException;
import net.morkit.api.parser.Mapper;
import net.morkit.api.parser.Mappers;
import net.morkit.api.parser.MappingException;
import net.morkit.api.parser.ParseTree;
import net.morkit.api.parser.RecordMapper;
import net.morkit.api.parser.TextLocation;
import net.morkit.api.parser.UnionMapper;
import net.morkit.util.Locations;

/**
 * Converts parse trees of MorDictGrammar into dictionary nodes.
 * Comment runs end up attached to the item they follow. Comments of the
 * form "% DISABLED: entry" that trail an entry (or the header) are turned
 * back into disabled entries if their body is a well-formed entry.
 */
public class MorDictMapper {

    private static final Logger LOGGER = Logger.getLogger("MorDictMapper");

    public static final Mapper<Comment> COMMENT =
        new RecordMapper<Comment>() {
            protected Comment mapInner(Provider p) throws MappingException {
                if (! p.hasNext())
                    return new Comment("", p.getParseTree().getStart());
                ParseTree text = p.next();
                return new Comment(text.getContent().trim(),
                                   text.getStart());
            }
        };

    public static final Mapper<List<Comment>> COMMENTS =
        Mappers.aggregate(COMMENT);

    public static final Mapper<Preamble> PREAMBLE =
        new RecordMapper<Preamble>() {
            protected Preamble mapInner(Provider p) throws MappingException {
                String value = p.mapNextIf("PreambleText", Mappers.content(),
                                           "");
                return new Preamble(stripTrailing(value),
                    p.getParseTree().getStart(), p.mapNext(COMMENTS));
            }
        };

    public static final Mapper<Phon> PHON =
        new RecordMapper<Phon>() {
            protected Phon mapInner(Provider p) throws MappingException {
                ParseTree text = p.next();
                return new Phon(text.getContent(), text.getStart(),
                                p.mapNext(COMMENTS));
            }
        };

    public static final Mapper<CatAttrVal> ATTR_VAL =
        new RecordMapper<CatAttrVal>() {
            protected CatAttrVal mapInner(Provider p)
                    throws MappingException {
                String key = p.mapNext(Mappers.unwrap(Mappers.content()));
                List<String> values = p.mapNext(
                    Mappers.aggregate(Mappers.content()));
                return new CatAttrVal(key, values,
                    p.getParseTree().getStart(), p.mapNext(COMMENTS));
            }
        };

    public static final Mapper<List<CatAttrVal>> ATTR_VALS =
        Mappers.aggregate(ATTR_VAL);

    /** Braced and braceless pair lists map alike. */
    public static final UnionMapper<List<CatAttrVal>> ATTR_VAL_LIST =
        new UnionMapper<List<CatAttrVal>>()
            .add(MorDictGrammar.ATTR_VALS, ATTR_VALS)
            .add(MorDictGrammar.BARE_ATTR_VALS, ATTR_VALS);

    public static final Mapper<Cat> CAT =
        new RecordMapper<Cat>() {
            protected Cat mapInner(Provider p) throws MappingException {
                TextLocation start = p.getParseTree().getStart();
                List<CatAttrVal> avs = p.mapNext(ATTR_VAL_LIST);
                if (p.hasNext())
                    return new Cat(avs, start, p.mapNext(COMMENTS));
                // Without braces, the comments after the last pair are
                // taken to belong to the whole category.
                int last = avs.size() - 1;
                CatAttrVal tail = avs.get(last);
                avs.set(last, tail.withComments(null));
                return new Cat(avs, start, tail.getComments());
            }
        };

    public static final Mapper<Sem> SEM =
        new RecordMapper<Sem>() {
            protected Sem mapInner(Provider p) throws MappingException {
                String value = p.mapNextIf("SemText", Mappers.content(), "");
                return new Sem(value, p.getParseTree().getStart(),
                               p.mapNext(COMMENTS));
            }
        };

    public static final Mapper<Gloss> GLOSS =
        new RecordMapper<Gloss>() {
            protected Gloss mapInner(Provider p) throws MappingException {
                String value = p.mapNextIf("GlossText", Mappers.content(),
                                           "");
                return new Gloss(value, p.getParseTree().getStart(),
                                 p.mapNext(COMMENTS));
            }
        };

    public static final Mapper<LexEntry> ENTRY =
        new RecordMapper<LexEntry>() {
            protected LexEntry mapInner(Provider p) throws MappingException {
                Phon phon = p.mapNext(PHON);
                Cat cat = p.mapNext(CAT);
                Sem sem = p.mapNextIf(MorDictGrammar.SEM, SEM, null);
                Gloss gloss = p.mapNextIf(MorDictGrammar.GLOSS, GLOSS, null);
                return new LexEntry(phon, cat, sem, gloss, true,
                                    p.getParseTree().getStart(), null);
            }
        };

    private final MorDictParser parser;
    private final String sourceName;

    /**
     * Create a mapper for a document read from the given source.
     * The parser is used to re-read the bodies of DISABLED comments; if it
     * is null, such comments are left alone.
     */
    public MorDictMapper(MorDictParser parser, String sourceName) {
        this.parser = parser;
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * Map a whole-document parse tree (as returned by the parser) into a
     * Dictionary with the given name.
     */
    public Dictionary mapDocument(ParseTree root, String name)
            throws MappingException {
        if (root.childCount() != 1)
            throw new MappingException("Parse tree " + root.getName() +
                " should have exactly one child");
        RecordMapper.Provider p = new RecordMapper.Provider(
            root.childAt(0));
        List<Comment> leading = p.mapNext(COMMENTS);
        List<Preamble> preambles = p.mapNext(
            Mappers.aggregate(PREAMBLE));
        List<LexEntry> parsed = p.mapNext(Mappers.aggregate(ENTRY));
        if (p.hasNext())
            throw new MappingException("Parse tree " +
                p.getParseTree().getName() + " has too many children");
        Dictionary ret = new Dictionary(name);
        List<LexEntry> entries = ret.getEntries();
        // Header region: comments after the last preamble, or the leading
        // comments if there are no preambles.
        if (preambles.isEmpty()) {
            leading = extractDisabled(leading, entries);
        } else {
            int last = preambles.size() - 1;
            Preamble tail = preambles.get(last);
            List<Comment> kept = extractDisabled(tail.getComments(),
                                                 entries);
            if (kept.size() != tail.getComments().size())
                preambles.set(last, tail.withComments(kept));
        }
        ret.getComments().addAll(leading);
        ret.getPreambles().addAll(preambles);
        for (LexEntry e : parsed) {
            List<Comment> trailing = trailingComments(e);
            int index = entries.size();
            entries.add(e);
            List<Comment> kept = extractDisabled(trailing, entries);
            if (kept.size() != trailing.size())
                entries.set(index, withTrailingComments(e, kept));
        }
        return ret;
    }

    /**
     * Split a comment run at DISABLED comments.
     * Disabled entries found are appended to sink, each carrying the
     * comments up to the next such entry; the comments in front of the
     * first one are returned.
     */
    protected List<Comment> extractDisabled(List<Comment> comments,
                                            List<LexEntry> sink) {
        List<Comment> ret = new ArrayList<Comment>();
        List<Comment> current = ret;
        LexEntry pending = null;
        for (Comment c : comments) {
            LexEntry d = readDisabled(c);
            if (d == null) {
                current.add(c);
                continue;
            }
            if (pending != null) sink.add(pending.withComments(current));
            pending = d;
            current = new ArrayList<Comment>();
        }
        if (pending != null) sink.add(pending.withComments(current));
        return ret;
    }

    /**
     * Return the disabled entry the given comment stands for, or null.
     */
    protected LexEntry readDisabled(Comment c) {
        String text = c.getValue();
        if (parser == null || ! text.startsWith(LexEntry.DISABLED_MARKER))
            return null;
        int offset = LexEntry.DISABLED_MARKER.length();
        while (offset < text.length() &&
               Character.isWhitespace(text.charAt(offset)))
            offset++;
        String body = text.substring(offset);
        TextLocation origin = (c.getPosition() == null) ? null :
            Locations.after(c.getPosition(), text.substring(0, offset));
        try {
            LexEntry ret = parser.parseEntry(sourceName, body, origin);
            ret.setEnabled(false);
            return ret;
        } catch (LocatedParserException exc) {
            LOGGER.log(Level.FINE, "Keeping DISABLED comment that does " +
                       "not contain an entry: " + exc.getMessage(), exc);
            return null;
        }
    }

    /**
     * The comments of the last item the entry had in the source.
     */
    protected static List<Comment> trailingComments(LexEntry e) {
        if (e.getGloss().getPosition() != null)
            return e.getGloss().getComments();
        if (e.getSem().getPosition() != null)
            return e.getSem().getComments();
        return e.getCat().getComments();
    }

    protected static LexEntry withTrailingComments(LexEntry e,
                                                   List<Comment> comments) {
        Sem sem = e.getSem();
        Gloss gloss = e.getGloss();
        Cat cat = e.getCat();
        if (gloss.getPosition() != null) {
            gloss = gloss.withComments(comments);
        } else if (sem.getPosition() != null) {
            sem = sem.withComments(comments);
        } else {
            cat = cat.withComments(comments);
        }
        return new LexEntry(e.getPhon(), cat, sem, gloss, e.isEnabled(),
                            e.getPosition(), e.getComments());
    }

    protected static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) end--;
        return s.substring(0, end);
    }

}
