package net.littleredcomputer.heap;

/**
 * Thrown by {@link BinaryHeap#insert} when the heap already holds its capacity.
 */
public class HeapFullException extends IllegalStateException {
    private final int capacity;

    HeapFullException(int capacity) {
        super("insert into full heap (capacity " + capacity + ")");
        this.capacity = capacity;
    }

    public int getCapacity() { return capacity; }
}
