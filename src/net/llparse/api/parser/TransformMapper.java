package net.llparse.api.parser;

/**
 * A Mapper that post-processes the result of another Mapper.
 * Typical use is converting the text of a leaf (as obtained through
 * Mappers.content()) into a literal value.
 */
public abstract class TransformMapper<F, T> implements Mapper<T> {

    private final Mapper<F> nested;

    public TransformMapper(Mapper<F> nested) {
        this.nested = nested;
    }

    protected Mapper<F> getNestedMapper() {
        return nested;
    }

    /**
     * Map the tree with the nested Mapper and convert the result.
     * An IllegalArgumentException thrown by transform() (such as a
     * NumberFormatException) is reported as a MappingException naming the
     * offending tree node.
     */
    public T map(Parser.ParseTree tree) throws MappingException {
        F value = getNestedMapper().map(tree);
        try {
            return transform(value);
        } catch (IllegalArgumentException exc) {
            throw new MappingException("Cannot convert " + tree.getName() +
                " value " + value + ": " + exc.getMessage(), exc);
        }
    }

    protected abstract T transform(F value) throws MappingException;

}
