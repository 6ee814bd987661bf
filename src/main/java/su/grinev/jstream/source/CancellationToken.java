package su.grinev.jstream.source;

import su.grinev.jstream.exception.StreamCancelledException;

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative cancellation signal. Observed by streams before every pull and by blocking sources while they wait.
 * Thread-safe; cancelling is one-way.
 */
public final class CancellationToken {

    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("CancellationToken.NONE cannot be cancelled");
        }
        List<Runnable> toRun;
        synchronized (callbacks) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(Runnable::run);
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new StreamCancelledException("The operation was cancelled");
        }
    }

    /**
     * Runs {@code callback} once on cancellation, immediately if already cancelled.
     * Closing the returned registration before that removes the callback.
     */
    public Registration register(Runnable callback) {
        if (!cancellable) {
            return () -> { };
        }
        synchronized (callbacks) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (callbacks) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return () -> { };
    }

    @Override
    public String toString() {
        return cancellable ? "CancellationToken{cancelled=" + cancelled + "}" : "CancellationToken.NONE";
    }

    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
