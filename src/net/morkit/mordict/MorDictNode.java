package net.morkit.mordict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.morkit.api.parser.TextLocation;

/**
 * Common base of the dictionary model's nodes.
 * Every node may remember where it started in the source and carries the
 * comments that immediately followed it there. Neither takes part in
 * equality.
 */
public abstract class MorDictNode {

    private final TextLocation position;
    private final List<Comment> comments;

    protected MorDictNode(TextLocation position, List<Comment> comments) {
        this.position = position;
        this.comments = (comments == null || comments.isEmpty()) ?
            Collections.<Comment>emptyList() :
            Collections.unmodifiableList(new ArrayList<Comment>(comments));
    }

    /**
     * Where this node started in its source, or null for nodes that were
     * created programmatically.
     */
    public TextLocation getPosition() {
        return position;
    }

    /**
     * The comments anchored to this node, in source order.
     */
    public List<Comment> getComments() {
        return comments;
    }

    /**
     * Render this node without comments.
     */
    public String toString() {
        StringBuilder sb = new StringBuilder();
        writeTo(new MorDictWriter(sb, false));
        return sb.toString();
    }

    protected abstract void writeTo(MorDictWriter writer);

}
