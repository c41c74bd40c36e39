package net.littleredcomputer.heap;

import java.util.NoSuchElementException;

public class EmptyHeapException extends NoSuchElementException {
    EmptyHeapException(String operation) {
        super(operation + " from empty heap");
    }
}
