package su.grinev.jstream;

import lombok.extern.slf4j.Slf4j;
import su.grinev.jstream.decode.ElementDecoder;
import su.grinev.jstream.exception.JsonSyntaxException;
import su.grinev.jstream.exception.StreamCancelledException;
import su.grinev.jstream.json.JsonReaderOptions;
import su.grinev.jstream.json.JsonValueSpan;
import su.grinev.jstream.json.TokenizerState;
import su.grinev.jstream.json.Utf8JsonTokenizer;
import su.grinev.jstream.json.token.TokenType;
import su.grinev.jstream.pool.ElementBuffer;
import su.grinev.jstream.source.ByteSequence;
import su.grinev.jstream.source.CancellationToken;
import su.grinev.jstream.source.ChunkReadResult;
import su.grinev.jstream.source.ChunkSource;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, single-pass sequence of the elements of one top-level JSON array read from a {@link ChunkSource}.
 * <p>
 * Each pull takes every unconsumed byte from the source, decodes all elements that are complete in it and hands
 * them out in array order before pulling again. Bytes of an element that is still incomplete are left unconsumed
 * and scanned again, together with the new bytes, on the next pull. The source is only waited on from
 * {@link #hasNext()}, and cancellation is checked there before each pull.
 * <p>
 * Errors are raised from {@link #hasNext()} after every element decoded before them has been returned.
 * The element buffer goes back to its pool when the stream ends, fails, is cancelled or is closed.
 * Closing the stream also closes the source. Not thread-safe.
 */
@Slf4j
public class JsonArrayStream<T> implements Iterator<T>, Iterable<T>, AutoCloseable {

    public enum State {
        AWAITING_ARRAY_START,
        INSIDE_ARRAY,
        DONE,
        CANCELLED,
        FAULTED,
        CLOSED;

        public boolean isTerminal() {
            return this != AWAITING_ARRAY_START && this != INSIDE_ARRAY;
        }
    }

    private final ChunkSource source;
    private final ElementDecoder<T> decoder;
    private final CancellationToken cancellationToken;
    private final JsonReaderOptions decodingOptions;
    private final boolean requireTopLevelArray;
    private final ElementBuffer<T> buffer;

    private State state = State.AWAITING_ARRAY_START;
    private TokenizerState tokenizerState;
    private int emitIndex;
    private int consumed;
    private long elementCount;
    private RuntimeException pendingFailure;
    private RuntimeException terminalFailure;
    private boolean iteratorTaken;

    JsonArrayStream(ChunkSource source, ElementDecoder<T> decoder, CancellationToken cancellationToken,
                    JsonStreamOptions options) {
        this.source = source;
        this.decoder = decoder;
        this.cancellationToken = cancellationToken;
        this.decodingOptions = JsonValueSpan.decodingOptions(options.getReaderOptions());
        this.requireTopLevelArray = options.isRequireTopLevelArray();
        this.tokenizerState = TokenizerState.initial(options.getReaderOptions());
        this.buffer = new ElementBuffer<>(options.getArrayPool(), options.getInitialBufferCapacity());
    }

    @Override
    public boolean hasNext() {
        while (true) {
            if (emitIndex < buffer.size()) {
                return true;
            }
            if (pendingFailure != null) {
                RuntimeException failure = pendingFailure;
                pendingFailure = null;
                terminate(State.FAULTED, failure);
                throw failure;
            }
            if (terminalFailure != null) {
                throw terminalFailure;
            }
            if (state.isTerminal()) {
                buffer.close();
                return false;
            }
            pull();
        }
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return buffer.take(emitIndex++);
    }

    /**
     * Returns this stream; it can be iterated only once.
     */
    @Override
    public Iterator<T> iterator() {
        if (iteratorTaken) {
            throw new IllegalStateException("A JSON array stream can only be iterated once");
        }
        iteratorTaken = true;
        return this;
    }

    /**
     * The remaining elements as a sequential {@link Stream}; closing it closes this stream.
     */
    public Stream<T> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED), false)
                .onClose(this::close);
    }

    public State state() {
        return state;
    }

    @Override
    public void close() {
        if (!state.isTerminal()) {
            state = State.CLOSED;
            log.debug("Array stream closed after {} elements", elementCount);
        }
        buffer.close();
        source.close();
    }

    private void pull() {
        try {
            pullCycle();
        } catch (StreamCancelledException e) {
            terminate(State.CANCELLED, e);
            throw e;
        } catch (RuntimeException e) {
            terminate(State.FAULTED, e);
            throw e;
        }
    }

    private void pullCycle() {
        buffer.reset();
        emitIndex = 0;
        cancellationToken.throwIfCancellationRequested();

        ChunkReadResult result = source.read(cancellationToken);
        ByteSequence chunk = result.buffer();
        long length = chunk.length();
        log.trace("Pulled {} bytes at offset {} (completed: {})", length, tokenizerState.getBytePosition(), result.completed());

        if (result.cancelled()) {
            source.advanceTo(0, 0);
            throw new StreamCancelledException("The pending read was cancelled");
        }
        if (length == 0 && result.completed()) {
            source.advanceTo(0, 0);
            if (state == State.INSIDE_ARRAY) {
                throw new JsonSyntaxException("Unexpected end of data, expected ']'", tokenizerState.getBytePosition(),
                        tokenizerState.getLineNumber(), tokenizerState.getBytePositionInLine());
            }
            finish();
            return;
        }

        byte[] bytes;
        int offset;
        int size;
        if (chunk.isSingleSegment()) {
            ByteSequence.Segment segment = chunk.first();
            bytes = segment.array();
            offset = segment.offset();
            size = segment.length();
        } else {
            bytes = chunk.toArray();
            offset = 0;
            size = bytes.length;
        }

        consumed = 0;
        try {
            scan(new Utf8JsonTokenizer(bytes, offset, size, result.completed(), tokenizerState));
        } catch (RuntimeException e) {
            pendingFailure = e;
        } finally {
            source.advanceTo(consumed, length);
        }

        if (pendingFailure == null && state == State.AWAITING_ARRAY_START && result.completed()) {
            finish();
        }
    }

    /**
     * Tokenizes one chunk, decoding every element that is complete in it. {@link #consumed} and
     * {@link #tokenizerState} move together, only past complete tokens.
     */
    private void scan(Utf8JsonTokenizer tokenizer) {
        while (state != State.DONE && tokenizer.read()) {
            TokenType type = tokenizer.getTokenType();
            if (type == TokenType.COMMENT) {
                continue;
            }

            if (state == State.AWAITING_ARRAY_START) {
                if (type == TokenType.START_ARRAY) {
                    state = State.INSIDE_ARRAY;
                    log.trace("Array start at offset {}", tokenizer.getTokenOffset());
                } else if (requireTopLevelArray) {
                    throw tokenizer.errorAtToken("Expected a JSON array but found " + type);
                }
                consumed = tokenizer.getBytesConsumed();
                tokenizerState = tokenizer.currentState();
                continue;
            }

            if (type == TokenType.END_ARRAY) {
                consumed = tokenizer.getBytesConsumed();
                tokenizerState = tokenizer.currentState();
                finish();
                break;
            }

            int start = tokenizer.getTokenStartIndex();
            long streamOffset = tokenizer.getTokenOffset();
            long lineNumber = tokenizer.getTokenLineNumber();
            long positionInLine = tokenizer.getTokenBytePositionInLine();
            if (!tokenizer.trySkip()) {
                break;
            }
            JsonValueSpan span = new JsonValueSpan(tokenizer.getBuffer(), start, tokenizer.getPosition() - start,
                    streamOffset, lineNumber, positionInLine, decodingOptions);
            buffer.add(decoder.decode(span));
            elementCount++;
            consumed = tokenizer.getBytesConsumed();
            tokenizerState = tokenizer.currentState();
        }
    }

    private void finish() {
        state = State.DONE;
        log.debug("Array stream completed with {} elements", elementCount);
    }

    private void terminate(State terminalState, RuntimeException failure) {
        state = terminalState;
        terminalFailure = failure;
        buffer.close();
        log.debug("Array stream {} after {} elements: {}", terminalState, elementCount, failure.toString());
    }
}
