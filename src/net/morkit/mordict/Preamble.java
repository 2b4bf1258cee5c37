package net.morkit.mordict;

import java.util.List;
import net.morkit.api.parser.TextLocation;

/**
 * An @ header line, such as @UTF8 or @Begin.
 */
public class Preamble extends MorDictValue {

    public Preamble(String value, TextLocation position,
                    List<Comment> comments) {
        super(value, position, comments);
    }
    public Preamble(String value) {
        this(value, null, null);
    }

    public NodeKind getKind() {
        return NodeKind.PREAMBLE;
    }

    public Preamble withComments(List<Comment> comments) {
        return new Preamble(getValue(), getPosition(), comments);
    }

}
