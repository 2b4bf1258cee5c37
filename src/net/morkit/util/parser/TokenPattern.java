package net.morkit.util.parser;

import java.util.regex.Matcher;

/**
 * A named token pattern as seen by the Lexer.
 */
public class TokenPattern {

    private final String name;
    private final Grammar.Terminal symbol;

    public TokenPattern(String name, Grammar.Terminal symbol) {
        if (name == null)
            throw new NullPointerException(
                "TokenPattern name may not be null");
        if (symbol == null)
            throw new NullPointerException(
                "TokenPattern symbol may not be null");
        this.name = name;
        this.symbol = symbol;
    }

    public String toString() {
        return name + "=" + symbol;
    }

    public String getName() {
        return name;
    }

    public Grammar.Terminal getSymbol() {
        return symbol;
    }

    public int getMatchRank() {
        return symbol.getMatchRank();
    }

    /**
     * How tokens of this kind are called in error messages.
     */
    public String describe() {
        return symbol.describe(name);
    }

    public Matcher matcher(CharSequence input) {
        return symbol.getPattern().matcher(input);
    }

}
