package su.grinev.jstream.pool;

import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Lock-free free list. Never blocks: an empty pool creates a new item, a full pool drops the returned one.
 */
public class FastPool<T> {
    private final ConcurrentLinkedDeque<T> pool;
    private final Supplier<T> supplier;
    private final AtomicInteger size;
    private final int maxSize;

    public FastPool(Supplier<T> supplier, int initialSize, int maxSize) {
        this.pool = new ConcurrentLinkedDeque<>();
        this.supplier = supplier;
        this.size = new AtomicInteger(0);
        this.maxSize = maxSize;

        for (int i = 0; i < initialSize; i++) {
            pool.addLast(supplier.get());
            size.incrementAndGet();
        }
    }

    public T get() {
        T item = pool.pollLast();
        if (item != null) {
            size.decrementAndGet();
            return item;
        }
        return supplier.get();
    }

    /**
     * @return false if the pool was full and the item was dropped
     */
    public boolean release(T item) {
        if (size.incrementAndGet() > maxSize) {
            size.decrementAndGet();
            return false;
        }
        pool.addLast(item);
        return true;
    }

    public int size() {
        return size.get();
    }
}
