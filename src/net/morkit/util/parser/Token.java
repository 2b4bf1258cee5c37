package net.morkit.util.parser;

import net.morkit.api.parser.TextLocation;
import net.morkit.util.Formats;

public class Token {

    private final String name;
    private final TextLocation start;
    private final TextLocation end;
    private final String content;

    public Token(String name, TextLocation start, TextLocation end,
                 String content) {
        if (name == null)
            throw new NullPointerException("Token name may not be null");
        if (start == null || end == null)
            throw new NullPointerException(
                "Token locations may not be null");
        if (content == null)
            throw new NullPointerException(
                "Token content may not be null");
        this.name = name;
        this.start = start;
        this.end = end;
        this.content = content;
    }

    public String toString() {
        if (content.isEmpty()) return name + " at " + start;
        return String.format("%s (%s) at %s", Formats.formatString(content),
                             name, start);
    }

    public boolean equals(Object other) {
        if (! (other instanceof Token)) return false;
        Token to = (Token) other;
        return (getName().equals(to.getName()) &&
                getStart().equals(to.getStart()) &&
                getContent().equals(to.getContent()));
    }

    public int hashCode() {
        return getName().hashCode() ^ getStart().hashCode() ^
            getContent().hashCode();
    }

    public String getName() {
        return name;
    }

    public TextLocation getStart() {
        return start;
    }

    public TextLocation getEnd() {
        return end;
    }

    public String getContent() {
        return content;
    }

    /**
     * Create a token with no content, as used for synthetic tokens.
     */
    public static Token synthetic(String name, TextLocation pos) {
        return new Token(name, pos, pos, "");
    }

}
