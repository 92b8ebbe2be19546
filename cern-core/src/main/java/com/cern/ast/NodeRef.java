package com.cern.ast;

/**
 * Non-owning handle to a node stored in a {@link NodeArena}.
 *
 * @param index slot index in the owning arena
 * @param <T>   static kind of the referenced node
 */
public record NodeRef<T extends Node>(int index) {
    public NodeRef {
        if (index < 0) {
            throw new IllegalArgumentException("Negative node index: " + index);
        }
    }

    /**
     * Views a handle as a handle to a supertype. Handles are read-only, so this is safe.
     */
    @SuppressWarnings("unchecked")
    public static <T extends Node> NodeRef<T> widen(NodeRef<? extends T> ref) {
        return (NodeRef<T>) ref;
    }

    @Override
    public String toString() {
        return "#" + index;
    }
}
