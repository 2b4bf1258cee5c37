package net.morkit.mordict;

import java.util.List;
import net.morkit.api.parser.TextLocation;

/**
 * The overall semantics (translation) of an entry; empty if absent.
 */
public class Sem extends MorDictValue {

    public static final Sem EMPTY = new Sem("");

    public Sem(String value, TextLocation position,
               List<Comment> comments) {
        super(value, position, comments);
    }
    public Sem(String value) {
        this(value, null, null);
    }

    public NodeKind getKind() {
        return NodeKind.SEM;
    }

    public Sem withComments(List<Comment> comments) {
        return new Sem(getValue(), getPosition(), comments);
    }

}
