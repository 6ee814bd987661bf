package su.grinev.jstream.source;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * {@link ChunkSource} over a blocking {@link InputStream}. Unconsumed bytes are kept at the front of one
 * buffer that doubles when a single element outgrows it.
 * <p>
 * A blocking {@link InputStream#read} cannot be interrupted by a {@link CancellationToken}; the token is checked
 * before each read only.
 */
@Slf4j
public class InputStreamChunkSource implements ChunkSource {

    public static final int DEFAULT_CHUNK_SIZE = 8192;

    private final InputStream in;
    private byte[] buffer;
    private int start;
    private int end;
    private int examined;
    private boolean eof;
    private boolean readInProgress;

    public InputStreamChunkSource(InputStream in) {
        this(in, DEFAULT_CHUNK_SIZE);
    }

    public InputStreamChunkSource(InputStream in, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.in = in;
        this.buffer = new byte[chunkSize];
    }

    @Override
    public ChunkReadResult read(CancellationToken cancellationToken) {
        if (readInProgress) {
            throw new IllegalStateException("advanceTo() must be called before the next read()");
        }
        cancellationToken.throwIfCancellationRequested();
        while (!eof && end - start <= examined) {
            fill();
        }
        readInProgress = true;
        return new ChunkReadResult(ByteSequence.of(buffer, start, end - start), eof, false);
    }

    @Override
    public void advanceTo(long consumed, long examinedTo) {
        if (!readInProgress) {
            throw new IllegalStateException("advanceTo() called without a read in progress");
        }
        if (consumed < 0 || consumed > examinedTo || examinedTo > end - start) {
            throw new IllegalArgumentException("Invalid positions consumed=%d examined=%d for buffer of %d"
                    .formatted(consumed, examinedTo, end - start));
        }
        start += (int) consumed;
        examined = (int) (examinedTo - consumed);
        if (start == end) {
            start = 0;
            end = 0;
        }
        readInProgress = false;
    }

    @Override
    public void close() {
        try {
            in.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void fill() {
        if (start > 0) {
            System.arraycopy(buffer, start, buffer, 0, end - start);
            end -= start;
            start = 0;
        }
        if (end == buffer.length) {
            byte[] larger = new byte[buffer.length * 2];
            System.arraycopy(buffer, 0, larger, 0, end);
            buffer = larger;
            log.trace("Input buffer grown to {} bytes", buffer.length);
        }
        try {
            int n = in.read(buffer, end, buffer.length - end);
            if (n < 0) {
                eof = true;
            } else {
                end += n;
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
