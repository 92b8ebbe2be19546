package com.cern.ast;

/**
 * The arena ran out of slots. Reported as an internal error, never recovered from.
 */
public class ArenaExhaustedException extends RuntimeException {
    private final int capacity;

    public ArenaExhaustedException(int capacity) {
        super("Node arena exhausted after " + capacity + " nodes");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
