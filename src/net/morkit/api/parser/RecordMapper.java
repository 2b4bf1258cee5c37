package net.morkit.api.parser;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A Mapper for nodes whose children form a fixed sequence, like the fields
 * of a record.
 * Subclasses consume the children in order through a Provider; running
 * short of children, or leaving some unconsumed, is a MappingException.
 */
public abstract class RecordMapper<T> implements Mapper<T> {

    /* Raised by Provider.next() and turned into a MappingException by
     * map(). */
    private static class NoSuchTreeException extends NoSuchElementException {

        public NoSuchTreeException(String message) {
            super(message);
        }

    }

    /**
     * A cursor over the children of the node being mapped.
     */
    public static class Provider implements Iterable<ParseTree>,
                                            Iterator<ParseTree> {

        private final ParseTree tree;
        private int index;

        public Provider(ParseTree tree) {
            this.tree = tree;
            this.index = 0;
        }

        public ParseTree getParseTree() {
            return tree;
        }

        public Iterator<ParseTree> iterator() {
            return this;
        }

        public boolean hasNext() {
            return index < tree.childCount();
        }

        /**
         * Whether the next child exists and is called name.
         */
        public boolean hasNext(String name) {
            return hasNext() && tree.childAt(index).getName().equals(name);
        }

        public ParseTree next() {
            if (! hasNext())
                throw new NoSuchTreeException("Parse tree " +
                    tree.getName() + " has too few children");
            return tree.childAt(index++);
        }

        public void remove() {
            throw new UnsupportedOperationException(
                "May not remove from ParseTree provider");
        }

        public <U> U mapNext(Mapper<U> mapper) throws MappingException {
            return mapper.map(next());
        }

        /**
         * Map the next child if it is called name (or, for a null name, if
         * there is one at all); otherwise return fallback and consume
         * nothing.
         */
        public <U> U mapNextIf(String name, Mapper<U> mapper, U fallback)
                throws MappingException {
            if (! ((name == null) ? hasNext() : hasNext(name)))
                return fallback;
            return mapper.map(next());
        }

    }

    public T map(ParseTree tree) throws MappingException {
        Provider p = new Provider(tree);
        T ret;
        try {
            ret = mapInner(p);
        } catch (NoSuchTreeException exc) {
            throw new MappingException(exc.getMessage(), exc);
        }
        if (p.hasNext())
            throw new MappingException("Parse tree " + tree.getName() +
                " has too many children");
        return ret;
    }

    protected abstract T mapInner(Provider p) throws MappingException;

}
