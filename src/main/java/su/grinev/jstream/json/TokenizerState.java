package su.grinev.jstream.json;

import lombok.AccessLevel;
import lombok.Getter;
import su.grinev.jstream.json.token.TokenType;

import java.util.Arrays;

/**
 * Continuation of a {@link Utf8JsonTokenizer} at a token boundary.
 * <p>
 * A tokenizer seeded with this state and fed the bytes starting at {@link #getBytePosition()}
 * produces the same tokens as one that never stopped. Instances are immutable.
 */
@Getter
public final class TokenizerState {

    private final JsonReaderOptions options;
    private final int depth;
    @Getter(AccessLevel.NONE)
    private final long[] containers;
    private final TokenType lastToken;
    private final boolean commaPending;
    private final long bytePosition;
    private final long lineNumber;
    private final long bytePositionInLine;

    TokenizerState(JsonReaderOptions options, int depth, long[] containers, TokenType lastToken, boolean commaPending,
                   long bytePosition, long lineNumber, long bytePositionInLine) {
        this.options = options;
        this.depth = depth;
        this.containers = containers;
        this.lastToken = lastToken;
        this.commaPending = commaPending;
        this.bytePosition = bytePosition;
        this.lineNumber = lineNumber;
        this.bytePositionInLine = bytePositionInLine;
    }

    public static TokenizerState initial(JsonReaderOptions options) {
        return initial(options, 0);
    }

    /**
     * State of a tokenizer that has seen nothing yet, for input that starts at {@code bytePosition} of a larger stream.
     */
    public static TokenizerState initial(JsonReaderOptions options, long bytePosition) {
        return initial(options, bytePosition, 1, 0);
    }

    public static TokenizerState initial(JsonReaderOptions options, long bytePosition, long lineNumber, long bytePositionInLine) {
        return new TokenizerState(options, 0, new long[1], TokenType.NONE, false, bytePosition, lineNumber, bytePositionInLine);
    }

    long[] copyContainers() {
        return Arrays.copyOf(containers, Math.max(containers.length, 1));
    }

    @Override
    public String toString() {
        return "TokenizerState{depth=%d, lastToken=%s, commaPending=%s, bytePosition=%d}"
                .formatted(depth, lastToken, commaPending, bytePosition);
    }
}
