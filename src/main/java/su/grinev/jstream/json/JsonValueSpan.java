package su.grinev.jstream.json;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Raw bytes of exactly one complete JSON value, as cut out of the stream by the array driver.
 *
 * @param bytes              backing array; only {@code [offset, offset + length)} belongs to the value
 * @param streamOffset       absolute offset of the first byte in the whole stream
 * @param lineNumber         line of the first byte, counting from 1
 * @param bytePositionInLine column of the first byte, counting from 0
 * @param readerOptions      options used to tokenize the value again
 */
public record JsonValueSpan(byte[] bytes, int offset, int length, long streamOffset, long lineNumber,
                            long bytePositionInLine, JsonReaderOptions readerOptions) {

    public JsonValueSpan {
        Objects.requireNonNull(bytes, "bytes");
        Objects.checkFromIndexSize(offset, length, bytes.length);
        Objects.requireNonNull(readerOptions, "readerOptions");
    }

    public static JsonValueSpan of(byte[] json) {
        return new JsonValueSpan(json, 0, json.length, 0, 1, 0, JsonReaderOptions.DEFAULT);
    }

    public static JsonValueSpan of(String json) {
        return of(json.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns a tokenizer over this value, already positioned on its first token.
     */
    public Utf8JsonTokenizer openTokenizer() {
        TokenizerState state = TokenizerState.initial(readerOptions, streamOffset, lineNumber, bytePositionInLine);
        Utf8JsonTokenizer tokenizer = new Utf8JsonTokenizer(bytes, offset, length, true, state);
        tokenizer.readRequired();
        return tokenizer;
    }

    public String text() {
        return new String(bytes, offset, length, StandardCharsets.UTF_8);
    }

    /**
     * Options for re-reading a value that was already validated by the stream tokenizer.
     * Comment tokens are of no use to decoders, so {@link CommentHandling#ALLOW} becomes {@link CommentHandling#SKIP}.
     */
    public static JsonReaderOptions decodingOptions(JsonReaderOptions streamOptions) {
        if (streamOptions.getCommentHandling() != CommentHandling.ALLOW) {
            return streamOptions;
        }
        return streamOptions.toBuilder().commentHandling(CommentHandling.SKIP).build();
    }
}
