package net.morkit.morcomb;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An utterance together with its word-by-word annotation.
 */
public class Sentence {

    /**
     * The four per-word rows of a sentence, as they appear in text.
     */
    public static class Columns {

        private final List<AnalysisCandidates> mor;
        private final List<String> comb;
        private final List<String> penn;
        private final List<String> ort;

        public Columns(List<AnalysisCandidates> mor, List<String> comb,
                       List<String> penn, List<String> ort) {
            this.mor = Collections.unmodifiableList(mor);
            this.comb = Collections.unmodifiableList(comb);
            this.penn = Collections.unmodifiableList(penn);
            this.ort = Collections.unmodifiableList(ort);
        }

        public List<AnalysisCandidates> getMor() {
            return mor;
        }

        public List<String> getComb() {
            return comb;
        }

        public List<String> getPenn() {
            return penn;
        }

        public List<String> getOrt() {
            return ort;
        }

    }

    private final String id;
    private final String utterance;
    private final List<Word> words;

    public Sentence(String id, String utterance, List<Word> words) {
        if (words == null)
            throw new NullPointerException("Word list may not be null");
        this.id = (id == null) ? "" : id;
        this.utterance = (utterance == null) ? "" : utterance;
        this.words = Collections.unmodifiableList(
            new ArrayList<Word>(words));
    }

    public String toString() {
        return String.format("%s@%h[id=%s,words=%s]", getClass().getName(),
                             this, id, words.size());
    }

    public boolean equals(Object other) {
        if (! (other instanceof Sentence)) return false;
        Sentence so = (Sentence) other;
        return (id.equals(so.getId()) &&
                utterance.equals(so.getUtterance()) &&
                words.equals(so.getWords()));
    }

    public int hashCode() {
        return id.hashCode() ^ utterance.hashCode() * 31 ^ words.hashCode();
    }

    /** The @G: identifier. */
    public String getId() {
        return id;
    }

    /** The *CHI: line. */
    public String getUtterance() {
        return utterance;
    }

    public List<Word> getWords() {
        return words;
    }

    /**
     * Split the words back into their rows.
     */
    public Columns columns() {
        List<AnalysisCandidates> mor = new ArrayList<AnalysisCandidates>();
        List<String> comb = new ArrayList<String>();
        List<String> penn = new ArrayList<String>();
        List<String> ort = new ArrayList<String>();
        for (Word w : words) {
            mor.add(w.getCandidates());
            comb.add(w.getComb());
            penn.add(w.getPenn());
            ort.add(w.getOrt());
        }
        return new Columns(mor, comb, penn, ort);
    }

    /**
     * Build a sentence by zipping the given rows position by position.
     * Rows may differ in length; the longest one determines the number of
     * words, and the missing cells of shorter ones are padded with null
     * (candidates) or the empty string.
     */
    public static Sentence fromColumns(String id, String utterance,
                                       List<AnalysisCandidates> mor,
                                       List<String> comb, List<String> penn,
                                       List<String> ort) {
        int n = Math.max(Math.max(mor.size(), comb.size()),
                         Math.max(penn.size(), ort.size()));
        List<Word> words = new ArrayList<Word>(n);
        for (int i = 0; i < n; i++) {
            words.add(new Word(cell(mor, i), cell(comb, i), cell(penn, i),
                               cell(ort, i)));
        }
        return new Sentence(id, utterance, words);
    }
    public static Sentence fromColumns(String id, String utterance,
                                       Columns cols) {
        return fromColumns(id, utterance, cols.getMor(), cols.getComb(),
                           cols.getPenn(), cols.getOrt());
    }

    private static <T> T cell(List<T> column, int index) {
        return (index < column.size()) ? column.get(index) : null;
    }

}
