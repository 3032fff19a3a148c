package net.llparse.api.parser;

import java.util.Collections;
import java.util.List;

/**
 * Exception thrown during grammar validation.
 * The exception carries the complete list of structural issues found in the
 * grammar; its message joins them.
 */
public class InvalidGrammarException extends ParserException {

    private final List<String> issues;

    public InvalidGrammarException(List<String> issues) {
        super(formatIssues(issues));
        this.issues = Collections.unmodifiableList(issues);
    }
    public InvalidGrammarException(String message) {
        super(message);
        this.issues = Collections.singletonList(message);
    }
    public InvalidGrammarException(Throwable cause) {
        super(cause);
        this.issues = Collections.emptyList();
    }
    public InvalidGrammarException(String message, Throwable cause) {
        super(message, cause);
        this.issues = Collections.singletonList(message);
    }

    /**
     * The individual problems that were found.
     */
    public List<String> getIssues() {
        return issues;
    }

    private static String formatIssues(List<String> issues) {
        if (issues.size() == 1) return issues.get(0);
        StringBuilder sb = new StringBuilder("Invalid grammar (");
        sb.append(issues.size()).append(" issues)");
        for (String iss : issues) {
            sb.append("; ").append(iss);
        }
        return sb.toString();
    }

}
