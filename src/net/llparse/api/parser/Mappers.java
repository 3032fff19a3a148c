package net.llparse.api.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Various convenience Mapper implementations.
 */
public final class Mappers {

    private static final Mapper<String> CONTENT = new Mapper<String>() {
        public String map(Parser.ParseTree pt) throws MappingException {
            if (! pt.isTerminal() || pt.getToken() == null)
                throw new MappingException("Parse tree " + pt.getName() +
                    " should have a token");
            return pt.getToken().getContent();
        }
    };

    /* Prevent construction */
    private Mappers() {}

    /**
     * A Mapper that maps terminal parse trees to their tokens' contents.
     * If the parse tree passed to the mapper has no token, it is rejected
     * with a MappingException.
     */
    public static Mapper<String> content() {
        return CONTENT;
    }

    /**
     * A Mapper that always returns the given constant value.
     * The parse tree itself is not inspected.
     */
    public static <T> Mapper<T> constant(final T value) {
        return new Mapper<T>() {
            public T map(Parser.ParseTree tree) {
                return value;
            }
        };
    }

    /**
     * A Mapper that extracts the single child of a ParseTree and applies
     * another Mapper to that.
     * If the ParseTree does not have exactly one child, it is rejected with
     * a MappingException.
     */
    public static <T> Mapper<T> unwrap(final Mapper<T> inner) {
        return new RecordMapper<T>() {
            protected T mapInner(Provider p) throws MappingException {
                return p.mapNext(inner);
            }
        };
    }

    /**
     * A Mapper that flattens a right-recursive list into a Java list.
     * Grammars without repetition operators express lists as, e.g.,
     *
     *     Args    -> Expr ArgRest | ε
     *     ArgRest -> , Expr ArgRest | ε
     *
     * The returned mapper walks such a chain iteratively: children whose
     * names are among continuations are descended into (they must be the
     * last child of their parent), children whose names are among
     * separators are skipped, and every other child is mapped with element.
     * The returned list is modifiable.
     */
    public static <T> Mapper<List<T>> flatten(final Mapper<T> element,
            final Set<String> continuations, final Set<String> separators) {
        final Set<String> conts = new HashSet<String>(continuations);
        final Set<String> seps = new HashSet<String>(separators);
        return new Mapper<List<T>>() {
            public List<T> map(Parser.ParseTree pt) throws MappingException {
                List<T> ret = new ArrayList<T>();
                Parser.ParseTree cur = pt;
                while (cur != null) {
                    Parser.ParseTree next = null;
                    for (Parser.ParseTree child : cur.getChildren()) {
                        if (next != null)
                            throw new MappingException("List node " +
                                cur.getName() + " continues after " +
                                next.getName());
                        if (conts.contains(child.getName())) {
                            next = child;
                        } else if (! seps.contains(child.getName())) {
                            ret.add(element.map(child));
                        }
                    }
                    cur = next;
                }
                return ret;
            }
        };
    }
    public static <T> Mapper<List<T>> flatten(Mapper<T> element,
            String continuation, String separator) {
        return flatten(element, Collections.singleton(continuation),
            (separator == null) ? Collections.<String>emptySet() :
                                  Collections.singleton(separator));
    }

}
