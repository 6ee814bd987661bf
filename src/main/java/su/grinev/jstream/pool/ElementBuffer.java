package su.grinev.jstream.pool;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Growable list of decoded elements backed by an {@link ArrayPool} array. Holds one pull cycle's elements;
 * {@link #reset()} empties it for the next cycle without giving the array back.
 * {@link #close()} returns the array to the pool and may be called any number of times.
 */
@Slf4j
public class ElementBuffer<T> implements AutoCloseable {

    private final ArrayPool pool;
    private Object[] slots;
    private int size;

    public ElementBuffer(ArrayPool pool, int initialCapacity) {
        this.pool = pool;
        this.slots = pool.acquire(Math.max(initialCapacity, 1));
    }

    public void add(T element) {
        ensureOpen();
        if (size == slots.length) {
            slots = pool.grow(slots, size);
            log.trace("Element buffer grown to {}", slots.length);
        }
        slots[size++] = element;
    }

    @SuppressWarnings("unchecked")
    public T get(int index) {
        ensureOpen();
        checkIndex(index);
        return (T) slots[index];
    }

    /**
     * Returns the element and clears its slot, handing ownership to the caller.
     */
    @SuppressWarnings("unchecked")
    public T take(int index) {
        ensureOpen();
        checkIndex(index);
        T element = (T) slots[index];
        slots[index] = null;
        return element;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return slots == null ? 0 : slots.length;
    }

    public void reset() {
        ensureOpen();
        Arrays.fill(slots, 0, size, null);
        size = 0;
    }

    public boolean isReleased() {
        return slots == null;
    }

    @Override
    public void close() {
        if (slots == null) {
            return;
        }
        Object[] released = slots;
        slots = null;
        size = 0;
        pool.release(released, true);
    }

    private void ensureOpen() {
        if (slots == null) {
            throw new IllegalStateException("Element buffer has been released");
        }
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index %d out of bounds for size %d".formatted(index, size));
        }
    }
}
