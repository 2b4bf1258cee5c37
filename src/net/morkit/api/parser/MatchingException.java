package net.morkit.api.parser;

/**
 * Exception thrown when a TokenSource cannot satisfy a request for a token.
 * This covers input that matches no admissible token and inconsistent
 * indentation.
 */
public class MatchingException extends LocatedParserException {

    public MatchingException(String sourceName, TextLocation pos,
                             String detail) {
        super(sourceName, pos, detail);
    }
    public MatchingException(String sourceName, TextLocation pos,
                             String detail, Throwable cause) {
        super(sourceName, pos, detail, cause);
    }

}
