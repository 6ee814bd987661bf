package su.grinev.jstream.pool;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool of {@code Object[]} scratch arrays in power-of-two sizes, one free list per size.
 * <p>
 * Safe for concurrent use by independent streams. An array must be released exactly once by its borrower
 * and must not be touched after release.
 */
@Slf4j
public class ArrayPool {

    public static final int DEFAULT_ARRAYS_PER_BUCKET = 32;
    private static final int MAX_BUCKET = 30;
    private static final ArrayPool SHARED = new ArrayPool(DEFAULT_ARRAYS_PER_BUCKET);

    private final FastPool<Object[]>[] buckets;
    private final AtomicInteger borrowed = new AtomicInteger();

    @SuppressWarnings("unchecked")
    public ArrayPool(int arraysPerBucket) {
        if (arraysPerBucket < 0) {
            throw new IllegalArgumentException("arraysPerBucket must not be negative");
        }
        buckets = new FastPool[MAX_BUCKET + 1];
        for (int i = 0; i <= MAX_BUCKET; i++) {
            int length = 1 << i;
            buckets[i] = new FastPool<>(() -> new Object[length], 0, arraysPerBucket);
        }
    }

    /**
     * The process-wide pool used by streams that are not given their own.
     */
    public static ArrayPool shared() {
        return SHARED;
    }

    /**
     * Returns an array of at least {@code minimumLength} slots, rounded up to a power of two.
     */
    public Object[] acquire(int minimumLength) {
        Object[] array = buckets[bucketOf(minimumLength)].get();
        borrowed.incrementAndGet();
        return array;
    }

    /**
     * Replaces a borrowed array with one of twice its length holding the first {@code count} slots,
     * and releases the old array cleared.
     */
    public Object[] grow(Object[] array, int count) {
        if (array.length > 1 << (MAX_BUCKET - 1)) {
            throw new IllegalStateException("Cannot grow array beyond " + (1 << MAX_BUCKET));
        }
        Object[] larger = acquire(array.length * 2);
        System.arraycopy(array, 0, larger, 0, count);
        release(array, true);
        log.trace("Grew pooled array {} -> {}", array.length, larger.length);
        return larger;
    }

    /**
     * Returns an array to the pool; with {@code clear} its slots are nulled so the pool does not keep values alive.
     */
    public void release(Object[] array, boolean clear) {
        int length = array.length;
        if (length == 0 || Integer.bitCount(length) != 1 || length > 1 << MAX_BUCKET) {
            throw new IllegalArgumentException("Array of length %d was not acquired from this pool".formatted(length));
        }
        if (clear) {
            Arrays.fill(array, null);
        }
        borrowed.decrementAndGet();
        if (!buckets[Integer.numberOfTrailingZeros(length)].release(array)) {
            log.trace("Pool bucket for length {} is full, dropping array", length);
        }
    }

    /**
     * Arrays acquired and not yet released.
     */
    public int borrowedCount() {
        return borrowed.get();
    }

    private static int bucketOf(int minimumLength) {
        if (minimumLength > 1 << MAX_BUCKET) {
            throw new IllegalArgumentException("Cannot pool arrays longer than " + (1 << MAX_BUCKET));
        }
        if (minimumLength <= 1) {
            return 0;
        }
        return Integer.SIZE - Integer.numberOfLeadingZeros(minimumLength - 1);
    }
}
