package net.morkit.api.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Building blocks for composing Mapper-s.
 */
public final class Mappers {

    private static final Mapper<String> CONTENT = new Mapper<String>() {
        public String map(ParseTree tree) throws MappingException {
            String ret = tree.getContent();
            if (ret == null || tree.childCount() != 0)
                throw new MappingException("Parse tree " + tree.getName() +
                    " is not a token");
            return ret;
        }
    };

    /* Prevent construction */
    private Mappers() {}

    /**
     * Maps a token node to its text.
     */
    public static Mapper<String> content() {
        return CONTENT;
    }

    /**
     * Maps every child of a node with element and collects the results.
     * The list returned by the mapper may be modified by the caller.
     */
    public static <T> Mapper<List<T>> aggregate(final Mapper<T> element) {
        return new Mapper<List<T>>() {
            public List<T> map(ParseTree tree) throws MappingException {
                List<T> ret = new ArrayList<T>(tree.childCount());
                for (ParseTree child : tree.getChildren())
                    ret.add(element.map(child));
                return ret;
            }
        };
    }

    /**
     * Maps the only child of a node with inner.
     */
    public static <T> Mapper<T> unwrap(final Mapper<T> inner) {
        return new RecordMapper<T>() {
            protected T mapInner(Provider p) throws MappingException {
                return p.mapNext(inner);
            }
        };
    }

    /**
     * Like unwrap(), but yields fallback for a node without children.
     */
    public static <T> Mapper<T> unwrapOr(final Mapper<T> inner,
                                         final T fallback) {
        return new RecordMapper<T>() {
            protected T mapInner(Provider p) throws MappingException {
                return p.mapNextIf(null, inner, fallback);
            }
        };
    }

}
