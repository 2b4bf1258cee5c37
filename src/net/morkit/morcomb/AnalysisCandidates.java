package net.morkit.morcomb;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The alternative morphological analyses of a single word.
 * Written as the alternatives joined by carets.
 */
public class AnalysisCandidates {

    public static final String SEPARATOR = "^";

    private final List<String> alternatives;

    public AnalysisCandidates(List<String> alternatives) {
        if (alternatives == null)
            throw new NullPointerException(
                "Candidate list may not be null");
        if (alternatives.isEmpty())
            throw new IllegalArgumentException(
                "Candidate list may not be empty");
        this.alternatives = Collections.unmodifiableList(
            new ArrayList<String>(alternatives));
    }
    public AnalysisCandidates(String... alternatives) {
        this(Arrays.asList(alternatives));
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String a : alternatives) {
            if (sb.length() != 0) sb.append(SEPARATOR);
            sb.append(a);
        }
        return sb.toString();
    }

    public boolean equals(Object other) {
        if (! (other instanceof AnalysisCandidates)) return false;
        return alternatives.equals(
            ((AnalysisCandidates) other).getAlternatives());
    }

    public int hashCode() {
        return alternatives.hashCode();
    }

    public List<String> getAlternatives() {
        return alternatives;
    }

    public int size() {
        return alternatives.size();
    }

    public boolean isAmbiguous() {
        return alternatives.size() > 1;
    }

}
