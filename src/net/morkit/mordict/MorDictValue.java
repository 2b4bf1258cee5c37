package net.morkit.mordict;

import java.util.List;
import net.morkit.api.parser.TextLocation;

/**
 * A node consisting of a single string between fixed delimiters.
 */
public abstract class MorDictValue extends MorDictNode {

    private final String value;

    protected MorDictValue(String value, TextLocation position,
                           List<Comment> comments) {
        super(position, comments);
        if (value == null)
            throw new NullPointerException(
                getClass().getSimpleName() + " value may not be null");
        this.value = value;
    }

    public boolean equals(Object other) {
        if (other == null || other.getClass() != getClass()) return false;
        return value.equals(((MorDictValue) other).getValue());
    }

    public int hashCode() {
        return getClass().hashCode() ^ value.hashCode();
    }

    public String getValue() {
        return value;
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    public abstract NodeKind getKind();

    /**
     * Return a copy of this node with the given anchored comments.
     */
    public abstract MorDictValue withComments(List<Comment> comments);

    protected void writeTo(MorDictWriter writer) {
        writer.writeValue(this);
    }

}
