package net.morkit.api.parser;

/**
 * A position in a text source.
 * Lines and columns start at 1; the character index starts at 0 and counts
 * UTF-16 code units. A tab occupies a single column, and CR LF is a single
 * line break.
 */
public interface TextLocation {

    long getLine();

    long getColumn();

    long getCharacterIndex();

}
