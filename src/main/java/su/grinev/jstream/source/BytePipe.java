package su.grinev.jstream.source;

import lombok.extern.slf4j.Slf4j;
import su.grinev.jstream.exception.ChunkSourceException;
import su.grinev.jstream.exception.StreamCancelledException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory channel between a producer thread that writes bytes as they arrive and a stream that pulls them
 * through {@link #reader()}. Written bytes are kept as separate segments until the reader consumes them, so a
 * read may return a multi-segment {@link ByteSequence}.
 * <p>
 * A failure passed to {@link #complete(Throwable)} surfaces to the reader once it has examined every byte
 * written before the failure.
 */
@Slf4j
public class BytePipe {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition dataAvailable = lock.newCondition();
    private final Deque<ByteSequence.Segment> segments = new ArrayDeque<>();
    private final Reader reader = new Reader();

    private long buffered;
    private long examined;
    private boolean writerCompleted;
    private Throwable writerFailure;
    private boolean readerClosed;
    private boolean readInProgress;
    private boolean cancelPending;
    private long lastReadLength;

    public boolean write(byte[] bytes) {
        return write(bytes, 0, bytes.length);
    }

    /**
     * Appends a copy of the bytes.
     *
     * @return false if the reader has been closed and the bytes were discarded
     */
    public boolean write(byte[] bytes, int offset, int length) {
        byte[] copy = Arrays.copyOfRange(bytes, offset, offset + length);
        lock.lock();
        try {
            if (writerCompleted) {
                throw new IllegalStateException("Cannot write after complete()");
            }
            if (readerClosed) {
                return false;
            }
            if (length == 0) {
                return true;
            }
            segments.addLast(new ByteSequence.Segment(copy, 0, length));
            buffered += length;
            dataAvailable.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void complete() {
        complete(null);
    }

    /**
     * Marks the end of the data; a non-null {@code failure} is reported to the reader instead of end of data.
     */
    public void complete(Throwable failure) {
        lock.lock();
        try {
            if (writerCompleted) {
                return;
            }
            writerCompleted = true;
            writerFailure = failure;
            dataAvailable.signalAll();
        } finally {
            lock.unlock();
        }
        if (failure != null) {
            log.debug("Pipe writer completed with failure: {}", failure.toString());
        }
    }

    /**
     * Wakes the pending read, or the next one, with a result flagged as cancelled.
     */
    public void cancelPendingRead() {
        lock.lock();
        try {
            cancelPending = true;
            dataAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public ChunkSource reader() {
        return reader;
    }

    private ChunkReadResult doRead(CancellationToken cancellationToken) {
        cancellationToken.throwIfCancellationRequested();
        try (CancellationToken.Registration ignored = cancellationToken.register(this::cancelPendingRead)) {
            lock.lockInterruptibly();
            try {
                if (readerClosed) {
                    throw new IllegalStateException("Reader has been closed");
                }
                if (readInProgress) {
                    throw new IllegalStateException("advanceTo() must be called before the next read()");
                }
                while (buffered <= examined && !writerCompleted && !cancelPending) {
                    dataAvailable.await();
                }
                if (cancelPending) {
                    cancelPending = false;
                    cancellationToken.throwIfCancellationRequested();
                    return deliver(false, true);
                }
                if (writerFailure != null && buffered <= examined) {
                    throw failure(writerFailure);
                }
                return deliver(writerCompleted && writerFailure == null, false);
            } finally {
                lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StreamCancelledException("Interrupted while waiting for data");
        }
    }

    private ChunkReadResult deliver(boolean completed, boolean cancelled) {
        readInProgress = true;
        lastReadLength = buffered;
        return new ChunkReadResult(ByteSequence.of(new ArrayList<>(segments)), completed, cancelled);
    }

    private void doAdvanceTo(long consumed, long examinedTo) {
        lock.lock();
        try {
            if (!readInProgress) {
                throw new IllegalStateException("advanceTo() called without a read in progress");
            }
            if (consumed < 0 || consumed > examinedTo || examinedTo > lastReadLength) {
                throw new IllegalArgumentException("Invalid positions consumed=%d examined=%d for buffer of %d"
                        .formatted(consumed, examinedTo, lastReadLength));
            }
            long remaining = consumed;
            while (remaining > 0) {
                ByteSequence.Segment head = segments.removeFirst();
                if (head.length() > remaining) {
                    int skip = (int) remaining;
                    segments.addFirst(new ByteSequence.Segment(head.array(), head.offset() + skip, head.length() - skip));
                    remaining = 0;
                } else {
                    remaining -= head.length();
                }
            }
            buffered -= consumed;
            examined = examinedTo - consumed;
            readInProgress = false;
        } finally {
            lock.unlock();
        }
    }

    private void doClose() {
        lock.lock();
        try {
            readerClosed = true;
            segments.clear();
            buffered = 0;
            examined = 0;
            dataAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private static RuntimeException failure(Throwable failure) {
        if (failure instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        if (failure instanceof IOException ioException) {
            return new UncheckedIOException(ioException);
        }
        return new ChunkSourceException("Byte source failed", failure);
    }

    private class Reader implements ChunkSource {

        @Override
        public ChunkReadResult read(CancellationToken cancellationToken) {
            return doRead(cancellationToken);
        }

        @Override
        public void advanceTo(long consumed, long examined) {
            doAdvanceTo(consumed, examined);
        }

        @Override
        public void close() {
            doClose();
        }

        @Override
        public String toString() {
            return "BytePipe.Reader";
        }
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "BytePipe{buffered=%d, completed=%s}".formatted(buffered, writerCompleted);
        } finally {
            lock.unlock();
        }
    }
}
