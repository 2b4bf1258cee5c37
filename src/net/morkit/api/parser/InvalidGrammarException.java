package net.morkit.api.parser;

/**
 * Thrown when a grammar cannot be compiled.
 * This signals a programming error in the grammar (a dangling reference,
 * left recursion, or a choice that one token of lookahead cannot make),
 * never a problem with the input being parsed.
 */
public class InvalidGrammarException extends ParserException {

    public InvalidGrammarException(String message) {
        super(message);
    }

}
