package com.cern.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Owns every node of one parse. Nodes are appended to a growable slot list and
 * addressed by index, so handles stay valid however the list is relocated.
 * Capacity is fixed at construction and there is no per-node release: the
 * whole arena is dropped together with the tree built in it. Once a
 * {@link SyntaxTree} is built over the arena it is sealed and no longer
 * accepts new or rewritten nodes.
 *
 * <p>Not thread-safe; an arena belongs to a single parser.</p>
 */
public final class NodeArena {
    public static final int DEFAULT_CAPACITY = 1 << 20;

    private final List<Node> slots = new ArrayList<>();
    private final int capacity;
    private boolean sealed = false;

    public NodeArena() {
        this(DEFAULT_CAPACITY);
    }

    public NodeArena(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Arena capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Stores a node in a fresh slot.
     *
     * @throws ArenaExhaustedException if every slot is taken
     * @throws IllegalStateException if the arena is sealed
     */
    public <T extends Node> NodeRef<T> construct(T node) {
        Objects.requireNonNull(node, "node");
        checkNotSealed();
        if (slots.size() >= capacity) {
            throw new ArenaExhaustedException(capacity);
        }
        slots.add(node);
        return new NodeRef<>(slots.size() - 1);
    }

    @SuppressWarnings("unchecked")
    public <T extends Node> T get(NodeRef<T> ref) {
        return (T) slots.get(checkIndex(ref));
    }

    /**
     * Replaces the content of an existing slot. Only the left-associative fold
     * of the expression parser does this, after copying the old content into
     * a fresh slot.
     */
    public <T extends Node> void rewrite(NodeRef<T> ref, T node) {
        Objects.requireNonNull(node, "node");
        checkNotSealed();
        slots.set(checkIndex(ref), node);
    }

    /**
     * Freezes the arena. Idempotent.
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public int size() {
        return slots.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Read-only view of all slots in allocation order.
     */
    public List<Node> nodes() {
        return Collections.unmodifiableList(slots);
    }

    private void checkNotSealed() {
        if (sealed) {
            throw new IllegalStateException("Node arena is sealed");
        }
    }

    private int checkIndex(NodeRef<?> ref) {
        Objects.requireNonNull(ref, "ref");
        if (ref.index() >= slots.size()) {
            throw new IllegalArgumentException("Dangling node reference " + ref + " (arena holds " + slots.size() + " nodes)");
        }
        return ref.index();
    }
}
