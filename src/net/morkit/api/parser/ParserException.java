package net.morkit.api.parser;

/**
 * Common base of the checked exceptions raised while compiling grammars,
 * reading input, and building models from parse trees.
 */
public class ParserException extends Exception {

    public ParserException(String message) {
        super(message);
    }
    public ParserException(String message, Throwable cause) {
        super(message, cause);
    }

}
