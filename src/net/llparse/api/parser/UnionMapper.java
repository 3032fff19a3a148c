package net.llparse.api.parser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A Mapper dispatching to other mappers depending on the parse tree name.
 * This is the parse-tree-side counterpart to a tagged union: every grammar
 * symbol that may appear at a given place is registered along with the
 * Mapper responsible for it, and map() picks the matching child. Parse
 * trees whose names are not registered are rejected with a
 * MappingException.
 */
public class UnionMapper<T> implements Mapper<T> {

    private final String description;
    private final Map<String, Mapper<? extends T>> children;

    /**
     * Create a new UnionMapper with no children.
     * The description is used in error messages (e.g. "statement").
     */
    public UnionMapper(String description) {
        this.description = description;
        this.children = new LinkedHashMap<String, Mapper<? extends T>>();
    }
    public UnionMapper() {
        this("parse tree");
    }

    public String getDescription() {
        return description;
    }

    /**
     * Return the children of this UnionMapper.
     */
    public Map<String, Mapper<? extends T>> getChildren() {
        return children;
    }

    /**
     * Register a new child.
     * Returns this instance for chaining.
     */
    public UnionMapper<T> add(String name, Mapper<? extends T> child) {
        if (children.containsKey(name))
            throw new IllegalArgumentException("Duplicate mapper for " +
                name);
        children.put(name, child);
        return this;
    }

    /**
     * Test whether the given parse tree can be processed by this UnionMapper.
     */
    public boolean canMap(Parser.ParseTree tree) {
        return children.containsKey(tree.getName());
    }

    public T map(Parser.ParseTree tree) throws MappingException {
        Mapper<? extends T> child = children.get(tree.getName());
        if (child == null)
            throw new MappingException("Cannot map " + tree.getName() +
                " as " + description);
        return child.map(tree);
    }

}
