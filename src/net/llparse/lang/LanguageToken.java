package net.llparse.lang;

import net.llparse.api.parser.Token;

public class LanguageToken implements Token {

    private final TokenType type;
    private final String content;

    public LanguageToken(TokenType type, String content) {
        if (type == null)
            throw new NullPointerException("Token type may not be null");
        if (content == null)
            throw new NullPointerException("Token content may not be null");
        this.type = type;
        this.content = content;
    }

    public String toString() {
        return type + "('" + content + "')";
    }

    public boolean equals(Object other) {
        if (! (other instanceof LanguageToken)) return false;
        LanguageToken lo = (LanguageToken) other;
        return (type == lo.type && content.equals(lo.content));
    }

    public int hashCode() {
        return type.hashCode() ^ content.hashCode();
    }

    public TokenType getType() {
        return type;
    }

    public String getName() {
        return type.name();
    }

    public String getContent() {
        return content;
    }

    public static LanguageToken of(TokenType type, String content) {
        return new LanguageToken(type, content);
    }

    public static LanguageToken eof() {
        return new LanguageToken(TokenType.EOF, "");
    }

}
