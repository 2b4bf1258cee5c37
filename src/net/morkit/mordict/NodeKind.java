package net.morkit.mordict;

/**
 * The delimiters that surround each kind of node in dictionary text.
 */
public enum NodeKind {

    COMMENT("% ", "\n", false),
    PHON("", "", false),
    CAT("{", "}", false),
    CAT_ATTR_VAL("[", "]", false),
    SEM("=", "=", true),
    GLOSS("\"", "\"", true),
    PREAMBLE("@", "\n", true);

    private final String begin;
    private final String end;
    private final boolean omittable;

    private NodeKind(String begin, String end, boolean omittable) {
        this.begin = begin;
        this.end = end;
        this.omittable = omittable;
    }

    public String getBegin() {
        return begin;
    }

    public String getEnd() {
        return end;
    }

    /**
     * Whether an empty node of this kind is left out of the output.
     */
    public boolean isOmittable() {
        return omittable;
    }

}
