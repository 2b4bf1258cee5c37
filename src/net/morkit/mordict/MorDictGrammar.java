package net.morkit.mordict;

import net.morkit.util.parser.Grammar;

/**
 * The grammar of MOR dictionary files.
 * A file consists of leading comments, "@" preamble lines, and entries of
 * the form
 *
 *     phon	{[key value...]...} =semantics= "gloss"
 *
 * where the semantics and the gloss are optional and the braces around the
 * category may be left out. Every item may be followed by line breaks and
 * "%" comment lines, which are collected into a Comments node belonging to
 * that item.
 */
public class MorDictGrammar extends Grammar {

    public static final String DOCUMENT = "Document";
    public static final String LEADING_COMMENTS = "LeadingComments";
    public static final String PREAMBLES = "Preambles";
    public static final String PREAMBLE = "Preamble";
    public static final String ENTRIES = "Entries";
    public static final String ENTRY = "Entry";
    public static final String COMMENTS = "Comments";
    public static final String COMMENT = "Comment";
    public static final String PHON = "Phon";
    public static final String CAT = "Cat";
    public static final String ATTR_VALS = "AttrVals";
    public static final String BARE_ATTR_VALS = "BareAttrVals";
    public static final String ATTR_VAL = "AttrVal";
    public static final String ATTR_KEY = "AttrKey";
    public static final String ATTR_VALUES = "AttrValues";
    public static final String SEM = "Sem";
    public static final String GLOSS = "Gloss";

    private static final int DISCARD = Symbol.SYM_DISCARD;
    private static final int ANY = Symbol.SYM_OPTIONAL | Symbol.SYM_REPEAT;

    public MorDictGrammar() {
        super(
            /* Tokens */
            pattern("EndOfLine", "\r\n?|\n"),
            pattern("Space", "[ \t\f\u000b]+"),
            terminal("Percent", "%"),
            pattern("CommentText", "[^\r\n]+"),
            terminal("At", "@"),
            pattern("PreambleText", "[^%\r\n]+"),
            pattern("PhonText", "[^\\s{}\\[\\]%@=\"]+"),
            terminal("OpenBrace", "{"),
            terminal("CloseBrace", "}"),
            terminal("OpenBracket", "["),
            terminal("CloseBracket", "]"),
            pattern("FeatureText", "[^{}\\[\\]%\\s]+"),
            terminal("Equals", "="),
            pattern("SemText", "[^=%\r\n]+"),
            terminal("Quote", "\""),
            pattern("GlossText", "[^\"%\r\n]+"),
            /* Comments */
            prod(COMMENT, nt("Percent", DISCARD),
                 nt("CommentText", Symbol.SYM_OPTIONAL),
                 nt("EndOfLine", DISCARD | ANY)),
            prod(COMMENTS, nt(COMMENT, ANY)),
            /* Header */
            prod(PREAMBLE, nt("At", DISCARD),
                 nt("PreambleText", Symbol.SYM_OPTIONAL),
                 nt("EndOfLine", DISCARD | ANY),
                 nt(COMMENTS)),
            /* Entry items */
            prod(PHON, nt("PhonText"),
                 nt("EndOfLine", DISCARD | ANY),
                 nt(COMMENTS)),
            prod(ATTR_KEY, nt("FeatureText")),
            prod(ATTR_VALUES, nt("FeatureText", ANY)),
            prod(ATTR_VAL, nt("OpenBracket", DISCARD),
                 nt(ATTR_KEY), nt(ATTR_VALUES),
                 nt("CloseBracket", DISCARD),
                 nt("EndOfLine", DISCARD | ANY),
                 nt(COMMENTS)),
            prod(ATTR_VALS, nt(ATTR_VAL, ANY)),
            prod(BARE_ATTR_VALS, nt(ATTR_VAL, Symbol.SYM_REPEAT)),
            prod(CAT, nt("OpenBrace", DISCARD),
                 nt("EndOfLine", DISCARD | ANY),
                 nt(ATTR_VALS),
                 nt("CloseBrace", DISCARD),
                 nt("EndOfLine", DISCARD | ANY),
                 nt(COMMENTS)),
            prod(CAT, nt(BARE_ATTR_VALS)),
            prod(SEM, nt("Equals", DISCARD),
                 nt("SemText", Symbol.SYM_OPTIONAL),
                 nt("Equals", DISCARD),
                 nt("EndOfLine", DISCARD | ANY),
                 nt(COMMENTS)),
            prod(GLOSS, nt("Quote", DISCARD),
                 nt("GlossText", Symbol.SYM_OPTIONAL),
                 nt("Quote", DISCARD),
                 nt("EndOfLine", DISCARD | ANY),
                 nt(COMMENTS)),
            prod(ENTRY, nt(PHON), nt(CAT),
                 nt(SEM, Symbol.SYM_OPTIONAL),
                 nt(GLOSS, Symbol.SYM_OPTIONAL)),
            /* Overall file structure */
            prod(LEADING_COMMENTS, nt(COMMENT, ANY)),
            prod(PREAMBLES, nt(PREAMBLE, ANY)),
            prod(ENTRIES, nt(ENTRY, ANY)),
            prod(DOCUMENT, nt("EndOfLine", DISCARD | ANY),
                 nt(LEADING_COMMENTS), nt(PREAMBLES), nt(ENTRIES)),
            prod(START_SYMBOL, nt(DOCUMENT))
        );
        ignoreToken("Space");
    }

}
