package net.morkit.morcomb;

/**
 * One word of a sentence with its four aligned annotations.
 * A word produced by padding a short column has null candidates or empty
 * strings in the cells that were missing.
 */
public class Word {

    private final AnalysisCandidates candidates;
    private final String comb;
    private final String penn;
    private final String ort;

    public Word(AnalysisCandidates candidates, String comb, String penn,
                String ort) {
        this.candidates = candidates;
        this.comb = (comb == null) ? "" : comb;
        this.penn = (penn == null) ? "" : penn;
        this.ort = (ort == null) ? "" : ort;
    }

    public String toString() {
        return String.format("%s@%h[ort=%s]", getClass().getName(), this,
                             (ort.isEmpty()) ? comb : ort);
    }

    public boolean equals(Object other) {
        if (! (other instanceof Word)) return false;
        Word wo = (Word) other;
        return ((candidates == null ? wo.getCandidates() == null :
                 candidates.equals(wo.getCandidates())) &&
                comb.equals(wo.getComb()) && penn.equals(wo.getPenn()) &&
                ort.equals(wo.getOrt()));
    }

    public int hashCode() {
        return ((candidates == null) ? 0 : candidates.hashCode()) ^
            comb.hashCode() ^ penn.hashCode() * 31 ^ ort.hashCode();
    }

    /** The %mor: analyses; null for a padded cell. */
    public AnalysisCandidates getCandidates() {
        return candidates;
    }

    /** The %comb: form. */
    public String getComb() {
        return comb;
    }

    /** The %penn: tag. */
    public String getPenn() {
        return penn;
    }

    /** The %ort: orthography. */
    public String getOrt() {
        return ort;
    }

}
