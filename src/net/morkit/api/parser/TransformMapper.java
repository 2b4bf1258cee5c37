package net.morkit.api.parser;

/**
 * Post-processes the value produced by another Mapper.
 * Subclasses implement transform(), which may reject the value by throwing
 * a MappingException.
 */
public abstract class TransformMapper<F, T> implements Mapper<T> {

    private final Mapper<F> source;

    public TransformMapper(Mapper<F> source) {
        if (source == null)
            throw new NullPointerException("Source mapper may not be null");
        this.source = source;
    }

    public Mapper<F> getSource() {
        return source;
    }

    public T map(ParseTree tree) throws MappingException {
        return transform(source.map(tree));
    }

    protected abstract T transform(F value) throws MappingException;

}
