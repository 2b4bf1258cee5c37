package net.morkit.api.parser;

import java.util.List;

/**
 * A single concrete parse tree node.
 * A parse tree has a name (that is either the name of the underlying token
 * or the name of the grammar production that gave rise to the parse tree),
 * optional content (present on leaf nodes that stem from a token), a list of
 * child nodes, and the span of input it covers.
 */
public interface ParseTree {

    /**
     * The name of the token or production this node stems from.
     */
    String getName();

    /**
     * The text of the token this ParseTree directly corresponds to, or null.
     * Only leaf nodes may have content; given "discarded" symbols in the
     * grammar, some parse tree nodes may have no children (be "false
     * leaves") although they do not correspond to a single token.
     */
    String getContent();

    /**
     * The location of the first character covered by this node, or null if
     * the node covers no input at all.
     * Discarded tokens count towards the span of the nodes enclosing them.
     */
    TextLocation getStart();

    /**
     * The location just after the last character covered by this node, or
     * null if the node covers no input at all.
     */
    TextLocation getEnd();

    /**
     * An immutable list of this node's children.
     */
    List<ParseTree> getChildren();

    /**
     * Equivalent to getChildren().size().
     */
    int childCount();

    /**
     * Equivalent to getChildren().get(index).
     */
    ParseTree childAt(int index);

}
