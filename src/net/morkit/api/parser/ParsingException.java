package net.morkit.api.parser;

import java.util.Collections;
import java.util.List;

/**
 * Exception thrown on Parser errors.
 * Not to be confused with the generic ParserException.
 * Besides the location, a ParsingException may carry the user-readable
 * descriptions of the things that would have been acceptable at the place
 * where parsing failed.
 */
public class ParsingException extends LocatedParserException {

    private final List<String> expected;

    public ParsingException(String sourceName, TextLocation pos,
                            String detail, List<String> expected) {
        super(sourceName, pos, detail);
        this.expected = (expected == null) ?
            Collections.<String>emptyList() :
            Collections.unmodifiableList(expected);
    }
    public ParsingException(String sourceName, TextLocation pos,
                            String detail) {
        this(sourceName, pos, detail, null);
    }
    public ParsingException(LocatedParserException cause) {
        super(cause.getSourceName(), cause.getLocation(), cause.getDetail(),
              cause);
        this.expected = Collections.emptyList();
    }

    /**
     * What the parser would have accepted at the location of the error.
     * Tokens with fixed content are represented by their quoted content;
     * other tokens by their names. "end of input" stands for itself.
     */
    public List<String> getExpected() {
        return expected;
    }

}
