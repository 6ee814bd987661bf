package su.grinev.jstream.json;

public enum CommentHandling {
    /**
     * A comment is a syntax error.
     */
    DISALLOW,
    /**
     * Comments are accepted and dropped.
     */
    SKIP,
    /**
     * Comments are accepted and reported as {@link su.grinev.jstream.json.token.TokenType#COMMENT} tokens.
     */
    ALLOW
}
