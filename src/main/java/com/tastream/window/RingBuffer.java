package com.tastream.window;

import com.tastream.exception.InvalidParameterException;
import java.util.Arrays;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Fixed-capacity FIFO window over the last {@code capacity} values pushed, oldest first.
 *
 * <p>Pushing into a full buffer evicts exactly the oldest element and hands it back to the
 * caller so that running aggregates can subtract it. The buffer never grows beyond its
 * capacity.
 *
 * <p>Iteration is lazy, restartable and fail-fast: an iterator obtained before a
 * {@link #push} or {@link #reset()} throws {@link ConcurrentModificationException} on its
 * next step.
 *
 * <p>Not thread-safe. Owned by exactly one indicator.
 *
 * @param <T> element type
 */
public final class RingBuffer<T> implements Iterable<T> {

    private final Object[] elements;
    private int head;
    private int size;
    private int modCount;

    public RingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new InvalidParameterException(
                    "Ring buffer capacity must be positive", Map.of("parameter", "capacity", "value", capacity));
        }
        this.elements = new Object[capacity];
    }

    private RingBuffer(RingBuffer<T> other) {
        this.elements = other.elements.clone();
        this.head = other.head;
        this.size = other.size;
    }

    /**
     * Appends a value, evicting the oldest one if the buffer is full.
     *
     * @return the evicted value, or empty while the buffer is still filling up
     */
    public Optional<T> push(T value) {
        modCount++;
        int capacity = elements.length;
        if (size < capacity) {
            elements[(head + size) % capacity] = value;
            size++;
            return Optional.empty();
        }
        T evicted = elementAt(head);
        elements[head] = value;
        head = (head + 1) % capacity;
        return Optional.ofNullable(evicted);
    }

    /** Returns the i-th element, 0 being the oldest. */
    public T get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for size " + size);
        }
        return elementAt((head + index) % elements.length);
    }

    public T oldest() {
        if (size == 0) {
            throw new NoSuchElementException("Ring buffer is empty");
        }
        return elementAt(head);
    }

    public T newest() {
        if (size == 0) {
            throw new NoSuchElementException("Ring buffer is empty");
        }
        return elementAt((head + size - 1) % elements.length);
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return elements.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == elements.length;
    }

    public void reset() {
        modCount++;
        Arrays.fill(elements, null);
        head = 0;
        size = 0;
    }

    /** Returns an independent buffer holding the same elements in the same order. */
    public RingBuffer<T> copy() {
        return new RingBuffer<>(this);
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private final int expectedModCount = modCount;
            private int cursor;

            @Override
            public boolean hasNext() {
                checkForComodification();
                return cursor < size;
            }

            @Override
            public T next() {
                checkForComodification();
                if (cursor >= size) {
                    throw new NoSuchElementException();
                }
                return elementAt((head + cursor++) % elements.length);
            }

            private void checkForComodification() {
                if (modCount != expectedModCount) {
                    throw new ConcurrentModificationException();
                }
            }
        };
    }

    @SuppressWarnings("unchecked")
    private T elementAt(int slot) {
        return (T) elements[slot];
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(get(i));
        }
        return sb.append(']').toString();
    }
}
