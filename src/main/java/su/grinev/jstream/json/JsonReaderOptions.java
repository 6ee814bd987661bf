package su.grinev.jstream.json;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Lexical leniency of the tokenizer. The defaults accept strict RFC 8259 JSON only.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class JsonReaderOptions {

    public static final int DEFAULT_MAX_DEPTH = 64;
    public static final JsonReaderOptions DEFAULT = JsonReaderOptions.builder().build();

    @Builder.Default
    private final CommentHandling commentHandling = CommentHandling.DISALLOW;
    @Builder.Default
    private final boolean allowTrailingCommas = false;
    /**
     * Maximum nesting of objects and arrays; zero or less selects {@link #DEFAULT_MAX_DEPTH}.
     */
    @Builder.Default
    private final int maxDepth = 0;

    public int effectiveMaxDepth() {
        return maxDepth <= 0 ? DEFAULT_MAX_DEPTH : maxDepth;
    }
}
