package net.morkit.mordict;

import java.util.List;
import net.morkit.api.parser.TextLocation;

/**
 * A comment line.
 * The value excludes the percent sign and surrounding blanks. The position
 * of a parsed comment is that of its first non-blank character after the
 * percent sign (or of the percent sign for a blank comment). Comments never
 * carry comments of their own.
 */
public class Comment extends MorDictValue {

    public Comment(String value, TextLocation position) {
        super(value, position, null);
    }
    public Comment(String value) {
        this(value, null);
    }

    public NodeKind getKind() {
        return NodeKind.COMMENT;
    }

    public Comment withComments(List<Comment> comments) {
        if (comments != null && ! comments.isEmpty())
            throw new UnsupportedOperationException(
                "Comments cannot have comments");
        return this;
    }

}
