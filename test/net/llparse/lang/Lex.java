package net.llparse.lang;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/* A whitespace-separated stand-in for the language's lexer. Strings are
 * written in double quotes and may not contain spaces. */
final class Lex {

    private static final Set<String> OPERATORS = new HashSet<String>(
        Arrays.asList("+", "-", "*", "/", "%", "<", ">", "<=", ">=", "==",
                      "!=", "!", "^"));

    private Lex() {}

    static LanguageToken token(String word) {
        TokenType fixed = TokenType.forText(word);
        if (fixed != null) return LanguageToken.of(fixed, word);
        if (OPERATORS.contains(word))
            return LanguageToken.of(TokenType.BINARY_OPERATOR, word);
        char c = word.charAt(0);
        if (Character.isDigit(c))
            return LanguageToken.of(TokenType.NUMBER, word);
        if (c == '"')
            return LanguageToken.of(TokenType.STRING,
                                    word.substring(1, word.length() - 1));
        if (Character.isLetter(c))
            return LanguageToken.of(TokenType.IDENTIFIER, word);
        throw new IllegalArgumentException("Cannot tokenize " + word);
    }

    static List<LanguageToken> tokens(String text) {
        List<LanguageToken> ret = new ArrayList<LanguageToken>();
        for (String word : text.trim().split("\\s+")) {
            if (! word.isEmpty()) ret.add(token(word));
        }
        ret.add(LanguageToken.eof());
        return ret;
    }

}
