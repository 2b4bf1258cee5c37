package net.morkit.morcomb;

import net.morkit.util.parser.Grammar;

/**
 * The grammar of %mor/%comb sentence-annotation files.
 * Rows may be continued on following lines that are indented deeper than
 * the row header; the Indent and Dedent tokens that delimit such
 * continuation blocks are not matched by the lexer but produced by an
 * Indenter over the Newlines tokens.
 */
public class MorcombGrammar extends Grammar {

    public static final String NEWLINES = "Newlines";
    public static final String INDENT = "Indent";
    public static final String DEDENT = "Dedent";

    public static final String DOCUMENT = "Document";
    public static final String PREAMBLES = "Preambles";
    public static final String POSTAMBLES = "Postambles";
    public static final String AMBLE = "Amble";
    public static final String SENTENCES = "Sentences";
    public static final String SENTENCE = "Sentence";
    public static final String CHI_LINE = "ChiLine";
    public static final String MOR_LINE = "MorLine";
    public static final String COMB_LINE = "CombLine";
    public static final String PENN_LINE = "PennLine";
    public static final String ORT_LINE = "OrtLine";
    public static final String ID_LINE = "IdLine";
    public static final String CANDIDATES = "Candidates";

    private static final int DISCARD = Symbol.SYM_DISCARD;
    private static final int INLINE = Symbol.SYM_INLINE;
    private static final int OPTIONAL = Symbol.SYM_OPTIONAL;
    private static final int ANY = Symbol.SYM_OPTIONAL | Symbol.SYM_REPEAT;
    private static final int SOME = Symbol.SYM_REPEAT;

    public MorcombGrammar() {
        super(
            /* Tokens */
            pattern("Space", "[ \t\f\u000b]+"),
            pattern(NEWLINES, "(?:(?:\r\n?|\n)[ \t\f\u000b]*)+"),
            terminal("ChiHeader", "*CHI:"),
            terminal("MorHeader", "%mor:"),
            terminal("CombHeader", "%comb:"),
            terminal("PennHeader", "%penn:"),
            terminal("OrtHeader", "%ort:"),
            terminal("IdHeader", "@G:"),
            terminal("At", "@"),
            terminal("Caret", "^"),
            pattern("TillEOL", "[^\r\n]+"),
            pattern("Candidate", "[^\\s^]+"),
            pattern("Str", "\\S+"),
            /* Continuation blocks */
            prod("CandidateTail", nt("Caret", DISCARD), nt("Candidate")),
            prod(CANDIDATES, nt("Candidate"),
                 nt("CandidateTail", INLINE | ANY)),
            prod("MorRow", nt(CANDIDATES, ANY), nt(NEWLINES, DISCARD)),
            prod("MorBlock", nt(INDENT, DISCARD), nt("MorRow", INLINE | SOME),
                 nt(DEDENT, DISCARD)),
            prod("StrRow", nt("Str", ANY), nt(NEWLINES, DISCARD)),
            prod("StrBlock", nt(INDENT, DISCARD), nt("StrRow", INLINE | SOME),
                 nt(DEDENT, DISCARD)),
            /* Lines */
            prod(CHI_LINE, nt("ChiHeader", DISCARD),
                 nt("TillEOL", OPTIONAL), nt(NEWLINES, DISCARD)),
            prod(MOR_LINE, nt("MorHeader", DISCARD), nt(CANDIDATES, ANY),
                 nt(NEWLINES, DISCARD), nt("MorBlock", INLINE | OPTIONAL)),
            prod(COMB_LINE, nt("CombHeader", DISCARD), nt("Str", ANY),
                 nt(NEWLINES, DISCARD), nt("StrBlock", INLINE | OPTIONAL)),
            prod(PENN_LINE, nt("PennHeader", DISCARD), nt("Str", ANY),
                 nt(NEWLINES, DISCARD), nt("StrBlock", INLINE | OPTIONAL)),
            prod(ORT_LINE, nt("OrtHeader", DISCARD), nt("Str", ANY),
                 nt(NEWLINES, DISCARD), nt("StrBlock", INLINE | OPTIONAL)),
            prod(ID_LINE, nt("IdHeader", DISCARD),
                 nt("TillEOL", OPTIONAL), nt(NEWLINES, DISCARD | OPTIONAL)),
            prod(AMBLE, nt("At", DISCARD), nt("TillEOL", OPTIONAL),
                 nt(NEWLINES, DISCARD | OPTIONAL)),
            /* Overall file structure */
            prod(SENTENCE, nt(CHI_LINE), nt(MOR_LINE), nt(COMB_LINE),
                 nt(PENN_LINE), nt(ORT_LINE), nt(ID_LINE)),
            prod(PREAMBLES, nt(AMBLE, ANY)),
            prod(SENTENCES, nt(SENTENCE, ANY)),
            prod(POSTAMBLES, nt(AMBLE, ANY)),
            prod(DOCUMENT, nt(NEWLINES, DISCARD | OPTIONAL),
                 nt(PREAMBLES), nt(SENTENCES), nt(POSTAMBLES)),
            prod(START_SYMBOL, nt(DOCUMENT))
        );
        ignoreToken("Space");
        declareToken(INDENT);
        declareToken(DEDENT);
    }

}
