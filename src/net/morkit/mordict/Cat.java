package net.morkit.mordict;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import net.morkit.api.parser.TextLocation;

/**
 * The feature bundle of an entry.
 * Keys may occur more than once, so lookups yield all matching pairs in
 * order.
 */
public class Cat extends MorDictNode {

    private final List<CatAttrVal> attrVals;

    public Cat(List<CatAttrVal> attrVals, TextLocation position,
               List<Comment> comments) {
        super(position, comments);
        if (attrVals == null)
            throw new NullPointerException(
                "Cat feature list may not be null");
        this.attrVals = Collections.unmodifiableList(
            new ArrayList<CatAttrVal>(attrVals));
    }
    public Cat(List<CatAttrVal> attrVals) {
        this(attrVals, null, null);
    }
    public Cat(CatAttrVal... attrVals) {
        this(Arrays.asList(attrVals));
    }

    public boolean equals(Object other) {
        if (! (other instanceof Cat)) return false;
        return attrVals.equals(((Cat) other).getAttrVals());
    }

    public int hashCode() {
        return attrVals.hashCode();
    }

    public List<CatAttrVal> getAttrVals() {
        return attrVals;
    }

    /**
     * Iterate over the pairs with the given key.
     * Yields nothing if there is no such pair.
     */
    public Iterator<CatAttrVal> get(final String key) {
        final Iterator<CatAttrVal> all = attrVals.iterator();
        return new Iterator<CatAttrVal>() {

            private CatAttrVal pending = advance();

            private CatAttrVal advance() {
                while (all.hasNext()) {
                    CatAttrVal av = all.next();
                    if (av.getKey().equals(key)) return av;
                }
                return null;
            }

            public boolean hasNext() {
                return pending != null;
            }

            public CatAttrVal next() {
                if (pending == null) throw new NoSuchElementException();
                CatAttrVal ret = pending;
                pending = advance();
                return ret;
            }

            public void remove() {
                throw new UnsupportedOperationException(
                    "Cat is immutable");
            }

        };
    }

    public int count(String key) {
        int ret = 0;
        for (Iterator<CatAttrVal> it = get(key); it.hasNext(); it.next())
            ret++;
        return ret;
    }

    /**
     * The values of all pairs with the given key, in order.
     */
    public List<List<String>> valuesOf(String key) {
        List<List<String>> ret = new ArrayList<List<String>>();
        for (Iterator<CatAttrVal> it = get(key); it.hasNext(); )
            ret.add(it.next().getValues());
        return ret;
    }

    public Cat withComments(List<Comment> comments) {
        return new Cat(attrVals, getPosition(), comments);
    }

    protected void writeTo(MorDictWriter writer) {
        writer.writeCat(this);
    }

}
