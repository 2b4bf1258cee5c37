package net.morkit.api.parser;

/**
 * Thrown when a parse tree does not have the shape a Mapper expects.
 * Since the parser only emits trees its grammar allows, this indicates
 * that a grammar and its mappers have gone out of sync.
 */
public class MappingException extends ParserException {

    public MappingException(String message) {
        super(message);
    }
    public MappingException(String message, Throwable cause) {
        super(message, cause);
    }

}
