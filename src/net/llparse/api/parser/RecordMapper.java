package net.llparse.api.parser;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A convenience implementation of Mapper decomposing the input parse tree.
 * Subclasses process the children of a parse tree node one by one through
 * a Provider, which verifies the name of every child it hands out against
 * the expectations of the subclass:
 * - Fixed record-like shapes (e.g. "while ( Expr ) { StmtList }") are
 *   processed by a sequence of expect()/mapNext() calls; terminals that carry
 *   no information can be skipped by name.
 * - Alternatives of a production that differ in their tails are told apart
 *   via isNext().
 * Length checks (both for missing and for superfluous children) are
 * performed automatically; any mismatch results in a MappingException.
 */
public abstract class RecordMapper<T> implements Mapper<T> {

    /**
     * Cursor over the children of one parse tree node.
     * Instances are created by RecordMapper.map() and passed to mapInner().
     */
    public static class Provider implements Iterable<Parser.ParseTree>,
                                            Iterator<Parser.ParseTree> {

        private final Parser.ParseTree tree;
        private final Iterator<Parser.ParseTree> iterator;
        private Parser.ParseTree lookahead;

        public Provider(Parser.ParseTree tree) {
            this.tree = tree;
            this.iterator = tree.getChildren().iterator();
            this.lookahead = null;
        }

        /** Return the parse tree whose children are being processed. */
        public Parser.ParseTree getParseTree() {
            return tree;
        }

        public Iterator<Parser.ParseTree> iterator() {
            return this;
        }

        public boolean hasNext() {
            return (lookahead != null || iterator.hasNext());
        }

        public Parser.ParseTree next() {
            if (lookahead != null) {
                Parser.ParseTree ret = lookahead;
                lookahead = null;
                return ret;
            }
            return iterator.next();
        }

        /** Element removal is not supported. */
        public void remove() {
            throw new UnsupportedOperationException(
                "May not remove from ParseTree provider");
        }

        /**
         * Return the name of the next child without consuming it, or null
         * if there are no more children.
         */
        public String peekName() {
            if (lookahead == null) {
                if (! iterator.hasNext()) return null;
                lookahead = iterator.next();
            }
            return lookahead.getName();
        }

        /** Test whether the next child exists and has the given name. */
        public boolean isNext(String name) {
            return name.equals(peekName());
        }

        /**
         * Consume the next child, which must have the given name.
         */
        public Parser.ParseTree expect(String name) throws MappingException {
            String actual = peekName();
            if (actual == null)
                throw new MappingException("Parse tree " + tree.getName() +
                    " ends prematurely; expected " + name);
            if (! actual.equals(name))
                throw new MappingException("Parse tree " + tree.getName() +
                    ": expected " + name + ", got " + actual);
            return next();
        }

        /**
         * Consume the next child, which must be a terminal node with the
         * given name, and return the content of its token.
         */
        public String content(String name) throws MappingException {
            return Mappers.content().map(expect(name));
        }

        /** Consume the next child, whatever it is, and map it. */
        public <U> U mapNext(Mapper<U> mapper) throws MappingException {
            if (! hasNext())
                throw new MappingException("Parse tree " + tree.getName() +
                    " has too few children");
            return mapper.map(next());
        }

        /** Consume the next child, which must have the given name, and
         * map it. */
        public <U> U mapNext(String name, Mapper<U> mapper)
                throws MappingException {
            return mapper.map(expect(name));
        }

    }

    /**
     * Map the given parse tree to an object or throw an exception.
     * After constructing a Provider, this delegates to mapInner(), and
     * performs a final length check (to ensure that no children have been
     * missed).
     */
    public T map(Parser.ParseTree tree) throws MappingException {
        Provider p = new Provider(tree);
        T ret;
        try {
            ret = mapInner(p);
        } catch (NoSuchElementException exc) {
            throw new MappingException("Parse tree " + tree.getName() +
                " has too few children", exc);
        }
        if (p.hasNext())
            throw new MappingException("Parse tree " + tree.getName() +
                " has unexpected child " + p.peekName());
        return ret;
    }

    /**
     * Primary method for subclasses.
     */
    protected abstract T mapInner(Provider p) throws MappingException;

}
