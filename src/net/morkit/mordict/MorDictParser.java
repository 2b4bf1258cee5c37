package net.morkit.mordict;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.logging.Logger;
import net.morkit.api.parser.InvalidGrammarException;
import net.morkit.api.parser.MappingException;
import net.morkit.api.parser.MatchingException;
import net.morkit.api.parser.ParseTree;
import net.morkit.api.parser.ParsingException;
import net.morkit.api.parser.TextLocation;
import net.morkit.util.parser.Parser;

/**
 * Reads MOR dictionary files.
 * Instances hold nothing but the compiled grammar and can be shared
 * freely; every call builds its own lexer, parser, and model.
 */
public class MorDictParser {

    private static final Logger LOGGER = Logger.getLogger("MorDictParser");

    private final Parser.CompiledGrammar grammar;

    public MorDictParser(MorDictGrammar grammar) {
        try {
            this.grammar = Parser.compile(grammar);
        } catch (InvalidGrammarException exc) {
            throw new RuntimeException(exc);
        }
    }
    public MorDictParser() {
        this(new MorDictGrammar());
    }

    public Parser.CompiledGrammar getGrammar() {
        return grammar;
    }

    protected ParseTree parseTree(String sourceName, Reader input,
                                  TextLocation origin)
            throws MatchingException, ParsingException {
        Parser p = grammar.createParser(grammar.createLexer(sourceName,
                                                            input, origin));
        try {
            return p.parse();
        } finally {
            try {
                p.close();
            } catch (IOException exc) {
                throw new ParsingException(sourceName,
                    p.getTokenSource().getCurrentLocation(),
                    "Exception while closing parser: " + exc.getMessage());
            }
        }
    }

    /**
     * Check the given input for well-formedness without building a model.
     */
    public void check(String sourceName, Reader input)
            throws MatchingException, ParsingException {
        parseTree(sourceName, input, null);
    }
    public void check(String sourceName, String text)
            throws MatchingException, ParsingException {
        check(sourceName, new StringReader(text));
    }

    protected Dictionary parse(String name, Reader input,
                               TextLocation origin)
            throws MatchingException, ParsingException {
        ParseTree tree = parseTree(name, input, origin);
        Dictionary ret;
        try {
            ret = new MorDictMapper(this, name).mapDocument(tree, name);
        } catch (MappingException exc) {
            ParsingException wrapped = new ParsingException(name,
                tree.getStart(), "Malformed parse tree: " +
                exc.getMessage());
            wrapped.initCause(exc);
            throw wrapped;
        }
        return ret;
    }

    /**
     * Parse a whole dictionary.
     * The name labels error messages and becomes the name of the
     * Dictionary; if it is null, the dictionary gets an untitled name.
     */
    public Dictionary parse(String name, Reader input)
            throws MatchingException, ParsingException {
        Dictionary ret = parse(name, input, null);
        LOGGER.fine("Parsed dictionary " + ret.getName() + " with " +
                    ret.getPreambles().size() + " preambles and " +
                    ret.getEntries().size() + " entries");
        return ret;
    }
    public Dictionary parse(String name, String text)
            throws MatchingException, ParsingException {
        return parse(name, new StringReader(text));
    }

    /**
     * Parse text that must consist of exactly one entry, as found in the
     * body of a DISABLED comment.
     * origin is the location of the text within its enclosing source, or
     * null.
     */
    public LexEntry parseEntry(String sourceName, String text,
                               TextLocation origin)
            throws MatchingException, ParsingException {
        Dictionary d = parse(sourceName, new StringReader(text), origin);
        if (d.getEntries().size() != 1 || ! d.getComments().isEmpty() ||
                ! d.getPreambles().isEmpty())
            throw new ParsingException(sourceName, origin,
                "Expected exactly one entry, got " +
                d.getEntries().size() + " entries, " +
                d.getComments().size() + " comments, and " +
                d.getPreambles().size() + " preambles");
        return d.getEntries().get(0);
    }

}
