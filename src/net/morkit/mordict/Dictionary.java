package net.morkit.mordict;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * A whole dictionary file: leading comments, preambles, and entries.
 * Unlike the nodes it contains, a Dictionary is mutable and compared by
 * identity.
 */
public class Dictionary {

    public static final String UNTITLED_PREFIX = "<UNTITLED>";

    private static final Random NAME_RNG = new Random();

    private final String name;
    private final List<Comment> comments;
    private final List<Preamble> preambles;
    private final List<LexEntry> entries;

    public Dictionary(String name) {
        this.name = (name == null) ? makeUntitledName() : name;
        this.comments = new ArrayList<Comment>();
        this.preambles = new ArrayList<Preamble>();
        this.entries = new ArrayList<LexEntry>();
    }
    public Dictionary() {
        this(null);
    }

    public String toString() {
        return String.format("%s@%h[name=%s,preambles=%s,entries=%s]",
            getClass().getName(), this, name, preambles.size(),
            entries.size());
    }

    public String getName() {
        return name;
    }

    /** The comments in front of the first preamble; modifiable. */
    public List<Comment> getComments() {
        return comments;
    }

    /** Modifiable. */
    public List<Preamble> getPreambles() {
        return preambles;
    }

    /** Modifiable. */
    public List<LexEntry> getEntries() {
        return entries;
    }

    /**
     * Replace all entries at once.
     */
    public void setEntries(List<LexEntry> replacement) {
        List<LexEntry> copy = new ArrayList<LexEntry>(replacement);
        entries.clear();
        entries.addAll(copy);
    }

    public static String makeUntitledName() {
        int suffix;
        synchronized (NAME_RNG) {
            suffix = NAME_RNG.nextInt(0x10000000);
        }
        return UNTITLED_PREFIX + String.format("%07X", suffix);
    }

}
