package net.morkit.mordict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.morkit.api.parser.TextLocation;

/**
 * A [key value...] feature pair of a category.
 * Whether the value is a single token or a list is decided by arity alone:
 * no tokens yield the empty scalar, one token a scalar, several a list.
 */
public class CatAttrVal extends MorDictNode {

    private final String key;
    private final List<String> values;

    public CatAttrVal(String key, List<String> tokens, TextLocation position,
                      List<Comment> comments) {
        super(position, comments);
        if (key == null)
            throw new NullPointerException(
                "CatAttrVal key may not be null");
        if (tokens == null)
            throw new NullPointerException(
                "CatAttrVal tokens may not be null");
        this.key = key;
        this.values = (tokens.isEmpty()) ?
            Collections.singletonList("") :
            Collections.unmodifiableList(new ArrayList<String>(tokens));
    }
    public CatAttrVal(String key, List<String> tokens) {
        this(key, tokens, null, null);
    }
    public CatAttrVal(String key, String value) {
        this(key, Collections.singletonList(value), null, null);
    }

    public boolean equals(Object other) {
        if (! (other instanceof CatAttrVal)) return false;
        CatAttrVal co = (CatAttrVal) other;
        return key.equals(co.getKey()) && values.equals(co.getValues());
    }

    public int hashCode() {
        return key.hashCode() ^ values.hashCode();
    }

    public String getKey() {
        return key;
    }

    /**
     * The tokens of the value; a scalar value is a one-element list.
     */
    public List<String> getValues() {
        return values;
    }

    public boolean isList() {
        return values.size() > 1;
    }

    public String getScalar() {
        if (isList())
            throw new IllegalStateException("Value of " + key +
                " is a list");
        return values.get(0);
    }

    public boolean valueContains(String fragment) {
        for (String v : values) {
            if (v.contains(fragment)) return true;
        }
        return false;
    }

    public CatAttrVal withComments(List<Comment> comments) {
        return new CatAttrVal(key, values, getPosition(), comments);
    }

    protected void writeTo(MorDictWriter writer) {
        writer.writeAttrVal(this);
    }

}
