package net.llparse.api.parser;

/**
 * Converts parse trees into domain objects, such as AST nodes.
 * Mappers are stateless and may be shared between threads; they are
 * composed from the building blocks in RecordMapper, UnionMapper,
 * TransformMapper, and Mappers.
 */
public interface Mapper<T> {

    /**
     * Convert the given parse tree.
     * A MappingException is thrown if the tree does not have the shape this
     * Mapper expects.
     */
    T map(Parser.ParseTree pt) throws MappingException;

}
