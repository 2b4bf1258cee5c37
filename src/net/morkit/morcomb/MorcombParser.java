package net.morkit.morcomb;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.logging.Logger;
import net.morkit.api.parser.InvalidGrammarException;
import net.morkit.api.parser.MappingException;
import net.morkit.api.parser.MatchingException;
import net.morkit.api.parser.ParseTree;
import net.morkit.api.parser.ParsingException;
import net.morkit.util.parser.Indenter;
import net.morkit.util.parser.Parser;

/**
 * Reads sentence-annotation files.
 * Like MorDictParser, an instance only holds its compiled grammar.
 */
public class MorcombParser {

    private static final Logger LOGGER = Logger.getLogger("MorcombParser");

    private final Parser.CompiledGrammar grammar;

    public MorcombParser(MorcombGrammar grammar) {
        try {
            this.grammar = Parser.compile(grammar);
        } catch (InvalidGrammarException exc) {
            throw new RuntimeException(exc);
        }
    }
    public MorcombParser() {
        this(new MorcombGrammar());
    }

    public Parser.CompiledGrammar getGrammar() {
        return grammar;
    }

    protected ParseTree parseTree(String sourceName, Reader input)
            throws MatchingException, ParsingException {
        Indenter tokens = new Indenter(
            grammar.createLexer(sourceName, input),
            MorcombGrammar.NEWLINES, MorcombGrammar.INDENT,
            MorcombGrammar.DEDENT);
        Parser p = grammar.createParser(tokens);
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

    public void check(String sourceName, Reader input)
            throws MatchingException, ParsingException {
        parseTree(sourceName, input);
    }

    public Annotation parse(String sourceName, Reader input)
            throws MatchingException, ParsingException {
        ParseTree tree = parseTree(sourceName, input);
        Annotation ret;
        try {
            ret = MorcombMapper.FILE.map(tree);
        } catch (MappingException exc) {
            ParsingException wrapped = new ParsingException(sourceName,
                tree.getStart(), "Malformed parse tree: " +
                exc.getMessage());
            wrapped.initCause(exc);
            throw wrapped;
        }
        LOGGER.fine("Parsed " + sourceName + " with " +
                    ret.getSentences().size() + " sentences");
        return ret;
    }
    public Annotation parse(String sourceName, String text)
            throws MatchingException, ParsingException {
        return parse(sourceName, new StringReader(text));
    }

}
