package net.morkit.morcomb;

import java.util.ArrayList;
import java.util.List;

/**
 * A whole sentence-annotation file.
 * Mutable; the lists returned by the getters may be modified in place.
 */
public class Annotation {

    private final List<String> preambles;
    private final List<Sentence> sentences;
    private final List<String> postambles;

    public Annotation() {
        preambles = new ArrayList<String>();
        sentences = new ArrayList<Sentence>();
        postambles = new ArrayList<String>();
    }

    public String toString() {
        return String.format("%s@%h[sentences=%s]", getClass().getName(),
                             this, sentences.size());
    }

    /** The "@" lines in front of the first sentence, without the "@". */
    public List<String> getPreambles() {
        return preambles;
    }

    public List<Sentence> getSentences() {
        return sentences;
    }

    /** The "@" lines after the last sentence, without the "@". */
    public List<String> getPostambles() {
        return postambles;
    }

}
