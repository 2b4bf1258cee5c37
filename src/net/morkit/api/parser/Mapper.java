package net.morkit.api.parser;

/**
 * Turns a parse tree node into a model value.
 * Mappers are stateless and are composed to mirror the productions of the
 * grammar whose trees they consume.
 */
public interface Mapper<T> {

    T map(ParseTree tree) throws MappingException;

}
