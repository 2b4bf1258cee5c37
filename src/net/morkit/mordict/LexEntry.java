package net.morkit.mordict;

import java.util.List;
import net.morkit.api.parser.TextLocation;

/**
 * A single dictionary entry.
 * Entries are values except for their enabled flag, which marks whether
 * the entry is in effect or has been masked; a masked entry is written out
 * as a single DISABLED comment line.
 */
public class LexEntry extends MorDictNode {

    /** Prefix of the comment text that represents a masked entry. */
    public static final String DISABLED_MARKER = "DISABLED:";

    private final Phon phon;
    private final Cat cat;
    private final Sem sem;
    private final Gloss gloss;
    private boolean enabled;

    public LexEntry(Phon phon, Cat cat, Sem sem, Gloss gloss,
                    boolean enabled, TextLocation position,
                    List<Comment> comments) {
        super(position, comments);
        if (phon == null)
            throw new NullPointerException("LexEntry phon may not be null");
        if (cat == null)
            throw new NullPointerException("LexEntry cat may not be null");
        this.phon = phon;
        this.cat = cat;
        this.sem = (sem == null) ? Sem.EMPTY : sem;
        this.gloss = (gloss == null) ? Gloss.EMPTY : gloss;
        this.enabled = enabled;
    }
    public LexEntry(Phon phon, Cat cat, Sem sem, Gloss gloss) {
        this(phon, cat, sem, gloss, true, null, null);
    }

    public boolean equals(Object other) {
        if (! (other instanceof LexEntry)) return false;
        LexEntry eo = (LexEntry) other;
        return (phon.equals(eo.getPhon()) && cat.equals(eo.getCat()) &&
                sem.equals(eo.getSem()) && gloss.equals(eo.getGloss()));
    }

    public int hashCode() {
        return phon.hashCode() ^ cat.hashCode() * 31 ^ sem.hashCode() ^
            gloss.hashCode();
    }

    public Phon getPhon() {
        return phon;
    }

    public Cat getCat() {
        return cat;
    }

    public Sem getSem() {
        return sem;
    }

    public Gloss getGloss() {
        return gloss;
    }

    public boolean isEnabled() {
        return enabled;
    }
    public void setEnabled(boolean e) {
        enabled = e;
    }

    public LexEntry withComments(List<Comment> comments) {
        return new LexEntry(phon, cat, sem, gloss, enabled, getPosition(),
                            comments);
    }

    protected void writeTo(MorDictWriter writer) {
        writer.writeEntry(this);
    }

}
