package net.littleredcomputer.heap;

import com.google.common.base.Joiner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A max-heap of fixed capacity, stored in an array. The children of the element at
 * index i live at 2i+1 and 2i+2; every element compares greater than or equal to its
 * children. Passing {@link Comparator#reverseOrder()} yields a min-heap.
 * <p>
 * Not thread-safe. The capacity never changes after construction.
 * @param <T> element type; elements are never null
 */
public class BinaryHeap<T> {
    private static final Logger log = LogManager.getFormatterLogger(BinaryHeap.class);
    private static final Joiner slotJoiner = Joiner.on(' ').useForNull("_");

    private final T[] a;
    private final Comparator<? super T> order;
    private int n;  // live elements occupy a[0..n)

    private BinaryHeap(T[] a, int n, Comparator<? super T> order) {
        this.a = a;
        this.n = n;
        this.order = order;
    }

    /**
     * Creates an empty heap ordered by the natural ordering of its elements.
     * @param capacity maximum number of elements the heap will hold
     */
    public static <T extends Comparable<? super T>> BinaryHeap<T> create(int capacity) {
        return create(capacity, Comparator.naturalOrder());
    }

    public static <T> BinaryHeap<T> create(int capacity, Comparator<? super T> order) {
        checkArgument(capacity >= 0, "capacity must be non-negative: %s", capacity);
        checkNotNull(order);
        return new BinaryHeap<>(slots(capacity), 0, order);
    }

    /**
     * Builds a full heap from a copy of the given elements in linear time. The
     * capacity of the result is the number of elements.
     */
    public static <T extends Comparable<? super T>> BinaryHeap<T> copyOf(Collection<? extends T> elements) {
        return copyOf(elements, Comparator.naturalOrder());
    }

    public static <T> BinaryHeap<T> copyOf(Collection<? extends T> elements, Comparator<? super T> order) {
        checkNotNull(order);
        T[] a = slots(elements.size());
        int i = 0;
        for (T t : elements) a[i++] = checkNotNull(t, "null element");
        BinaryHeap<T> h = new BinaryHeap<>(a, a.length, order);
        h.heapify();
        return h;
    }

    // Only T values are ever stored, and the array never escapes.
    @SuppressWarnings("unchecked")
    private static <T> T[] slots(int capacity) {
        return (T[]) new Object[capacity];
    }

    private void heapify() {
        for (int i = n / 2; i >= 0; --i) siftDown(i);
        log.trace("heapified %d elements", n);
    }

    /**
     * @return the greatest element, without removing it
     * @throws EmptyHeapException if the heap is empty
     */
    public T top() {
        if (n == 0) throw new EmptyHeapException("top");
        return a[0];
    }

    /**
     * Removes and returns the greatest element in log(size) time.
     * @throws EmptyHeapException if the heap is empty
     */
    public T extractTop() {
        if (n == 0) throw new EmptyHeapException("extract");
        T top = a[0];
        a[0] = a[--n];
        a[n] = null;
        siftDown(0);
        return top;
    }

    /**
     * Adds a value in log(size) time.
     * @throws HeapFullException if size() == capacity(); the heap is not modified
     */
    public void insert(T value) {
        checkNotNull(value);
        if (n == a.length) throw new HeapFullException(a.length);
        a[n] = value;
        siftUp(n++);
    }

    /**
     * Removes the element at the given index. The last element takes its place and
     * is sifted whichever way the heap property demands, so no reserved value is
     * needed and every value of T may be stored.
     * @return the removed element
     * @throws IndexOutOfBoundsException unless 0 &lt;= index &lt; size()
     */
    public T remove(int index) {
        checkElementIndex(index, n);
        T removed = a[index];
        T last = a[--n];
        a[n] = null;
        if (index < n) {
            a[index] = last;
            if (index > 0 && order.compare(last, a[parent(index)]) > 0) siftUp(index);
            else siftDown(index);
        }
        return removed;
    }

    /**
     * Replaces the element at the given index and restores the heap property.
     * @return the index at which the new value came to rest
     * @throws IndexOutOfBoundsException unless 0 &lt;= index &lt; size()
     */
    public int changePriority(int index, T value) {
        checkElementIndex(index, n);
        checkNotNull(value);
        T old = a[index];
        a[index] = value;
        return order.compare(value, old) > 0 ? siftUp(index) : siftDown(index);
    }

    /**
     * Searches the live elements for one comparing equal to the given value. This
     * takes linear time; no index of values is kept.
     * @return the index of the first match in storage order, or -1
     * @throws NullPointerException if value is null; the heap never holds null
     */
    @CheckReturnValue
    public int find(T value) {
        checkNotNull(value);
        for (int i = 0; i < n; ++i) {
            if (order.compare(a[i], value) == 0) return i;
        }
        return -1;
    }

    /**
     * @return the element at the given index
     * @throws IndexOutOfBoundsException unless 0 &lt;= index &lt; size()
     */
    public T get(int index) {
        checkElementIndex(index, n);
        return a[index];
    }

    public boolean isEmpty() { return n == 0; }

    public boolean isFull() { return n == a.length; }

    public int size() { return n; }

    public int capacity() { return a.length; }

    public void clear() {
        Arrays.fill(a, 0, n, null);
        n = 0;
    }

    private static int parent(int i) { return (i - 1) / 2; }

    private int siftUp(int i) {
        while (i > 0 && order.compare(a[i], a[parent(i)]) > 0) {
            swap(i, parent(i));
            i = parent(i);
        }
        return i;
    }

    private int siftDown(int root) {
        int child;
        while ((child = 2*root+1) < n) {
            int swap = root;
            if (order.compare(a[child], a[swap]) > 0) swap = child;
            if (child+1 < n && order.compare(a[child+1], a[swap]) > 0) swap = child+1;
            if (swap == root) break;
            swap(root, swap);
            root = swap;
        }
        return root;
    }

    private void swap(int i, int j) {
        T tmp = a[i];
        a[i] = a[j];
        a[j] = tmp;
    }

    /**
     * Every storage slot in array order, live or not; unused slots print as "_".
     * Meant for debugging; the heap order of the output is not sorted order.
     */
    @Override
    public String toString() {
        return slotJoiner.join(a);
    }
}
