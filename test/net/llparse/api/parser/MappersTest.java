package net.llparse.api.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import junit.framework.TestCase;

public class MappersTest extends TestCase {

    private static class Node implements Parser.ParseTree {

        private final String name;
        private final Token token;
        private final List<Parser.ParseTree> children;

        Node(String name, Parser.ParseTree... children) {
            this.name = name;
            this.token = null;
            this.children = Arrays.asList(children);
        }
        Node(final String name, final String content) {
            this.name = name;
            this.token = new Token() {
                public String getName() {
                    return name;
                }
                public String getContent() {
                    return content;
                }
            };
            this.children = Collections.emptyList();
        }

        public String getName() {
            return name;
        }

        public boolean isTerminal() {
            return (token != null);
        }

        public Token getToken() {
            return token;
        }

        public List<Parser.ParseTree> getChildren() {
            return children;
        }

    }

    private static Parser.ParseTree leaf(String name, String content) {
        return new Node(name, content);
    }

    /* Args -> x ArgRest; ArgRest -> , x ArgRest | ε for "a, b, c" */
    private static Parser.ParseTree args() {
        return new Node("Args", leaf("x", "a"),
            new Node("ArgRest", leaf(",", ","), leaf("x", "b"),
                new Node("ArgRest", leaf(",", ","), leaf("x", "c"),
                    new Node("ArgRest"))));
    }

    public void testContent() throws Exception {
        assertEquals("a", Mappers.content().map(leaf("x", "a")));
        try {
            Mappers.content().map(new Node("X"));
            fail("Nonterminal has content");
        } catch (MappingException exc) {
            // expected
        }
    }

    public void testFlatten() throws Exception {
        List<String> items = Mappers.flatten(Mappers.content(), "ArgRest",
                                             ",").map(args());
        assertEquals(Arrays.asList("a", "b", "c"), items);
        assertEquals(Collections.emptyList(), Mappers.flatten(
            Mappers.content(), "ArgRest", ",").map(new Node("Args")));
    }

    public void testFlattenRejectsChildAfterContinuation() {
        Parser.ParseTree bad = new Node("Args", new Node("ArgRest"),
                                        leaf("x", "a"));
        try {
            Mappers.flatten(Mappers.content(), "ArgRest", ",").map(bad);
            fail("Malformed list flattened");
        } catch (MappingException exc) {
            assertTrue(exc.getMessage().contains("continues after"));
        }
    }

    public void testUnionMapper() throws Exception {
        UnionMapper<String> u = new UnionMapper<String>("atom")
            .add("x", Mappers.content())
            .add("y", Mappers.constant("why"));
        assertEquals("atom", u.getDescription());
        assertEquals("parse tree",
                     new UnionMapper<String>().getDescription());
        assertEquals("a", u.map(leaf("x", "a")));
        assertEquals("why", u.map(leaf("y", "b")));
        assertFalse(u.canMap(leaf("z", "c")));
        try {
            u.map(leaf("z", "c"));
            fail("Unregistered name mapped");
        } catch (MappingException exc) {
            assertEquals("Cannot map z as atom", exc.getMessage());
        }
        try {
            u.add("x", Mappers.content());
            fail("Duplicate name registered");
        } catch (IllegalArgumentException exc) {
            // expected
        }
    }

    public void testRecordMapperChecksLength() throws Exception {
        RecordMapper<String> first = new RecordMapper<String>() {
            protected String mapInner(Provider p) throws MappingException {
                return p.content("x");
            }
        };
        try {
            first.map(args());
            fail("Leftover children ignored");
        } catch (MappingException exc) {
            assertTrue(exc.getMessage().contains("unexpected child ArgRest"));
        }
        try {
            first.map(new Node("Args"));
            fail("Missing child ignored");
        } catch (MappingException exc) {
            assertTrue(exc.getMessage().contains("ends prematurely"));
        }
    }

    public void testRecordMapperProvider() throws Exception {
        final List<String> seen = new ArrayList<String>();
        RecordMapper<Integer> counter = new RecordMapper<Integer>() {
            protected Integer mapInner(Provider p) throws MappingException {
                seen.add(p.content("x"));
                assertTrue(p.isNext("ArgRest"));
                assertFalse(p.isNext("x"));
                p.expect("ArgRest");
                assertNull(p.peekName());
                return seen.size();
            }
        };
        assertEquals(Integer.valueOf(1), counter.map(args()));
        assertEquals(Arrays.asList("a"), seen);
    }

    public void testTransformAndUnwrap() throws Exception {
        Mapper<Integer> length = new TransformMapper<String, Integer>(
                Mappers.content()) {
            protected Integer transform(String value) {
                return value.length();
            }
        };
        assertEquals(Integer.valueOf(3),
                     Mappers.unwrap(length).map(new Node("W",
                         leaf("x", "abc"))));
    }

    public void testTransformFailureIsMappingException() {
        Mapper<Integer> number = new TransformMapper<String, Integer>(
                Mappers.content()) {
            protected Integer transform(String value) {
                return Integer.valueOf(value);
            }
        };
        try {
            number.map(leaf("number", "1x"));
            fail("Expected MappingException");
        } catch (MappingException exc) {
            assertTrue(exc.getMessage().startsWith(
                "Cannot convert number value 1x"));
            assertTrue(exc.getCause() instanceof NumberFormatException);
        }
    }

}
