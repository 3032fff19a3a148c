package net.llparse.util.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.llparse.api.parser.TerminalMapper;
import net.llparse.api.parser.Token;

/* Tokens named after the terminals they stand for. */
final class SimpleTokens {

    static class SimpleToken implements Token {

        private final String name;

        SimpleToken(String name) {
            this.name = name;
        }

        public String toString() {
            return name;
        }

        public String getName() {
            return name;
        }

        public String getContent() {
            return name;
        }

    }

    static final Set<String> OPERATORS = new HashSet<String>(
        Arrays.asList("+", "-", "*", "/"));

    static final TerminalMapper MAPPER = new TerminalMapper() {
        public String terminalFor(Token tok) {
            return tok.getName();
        }
        public boolean isOperator(Token tok) {
            return OPERATORS.contains(tok.getContent());
        }
    };

    private SimpleTokens() {}

    /* Split text at whitespace; no end marker is added implicitly. */
    static List<Token> tokens(String text) {
        List<Token> ret = new ArrayList<Token>();
        for (String word : text.trim().split("\\s+")) {
            if (! word.isEmpty()) ret.add(new SimpleToken(word));
        }
        return ret;
    }

}
