package net.morkit.mordict;

import java.util.List;
import net.morkit.api.parser.TextLocation;

/**
 * The morphological analysis (gloss) of an entry; empty if absent.
 */
public class Gloss extends MorDictValue {

    public static final Gloss EMPTY = new Gloss("");

    public Gloss(String value, TextLocation position,
                 List<Comment> comments) {
        super(value, position, comments);
    }
    public Gloss(String value) {
        this(value, null, null);
    }

    public NodeKind getKind() {
        return NodeKind.GLOSS;
    }

    public Gloss withComments(List<Comment> comments) {
        return new Gloss(getValue(), getPosition(), comments);
    }

}
