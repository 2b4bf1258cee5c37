package net.morkit.mordict;

import java.util.List;
import net.morkit.api.parser.TextLocation;

/**
 * The surface form of an entry. Always written, even when empty.
 */
public class Phon extends MorDictValue {

    public Phon(String value, TextLocation position,
                List<Comment> comments) {
        super(value, position, comments);
    }
    public Phon(String value) {
        this(value, null, null);
    }

    public NodeKind getKind() {
        return NodeKind.PHON;
    }

    public Phon withComments(List<Comment> comments) {
        return new Phon(getValue(), getPosition(), comments);
    }

}
