package com.cern.ast;

import java.util.Objects;

/**
 * A parsed program together with the arena that owns its nodes. Building the
 * tree seals the arena, so a finished tree can be read but never changed.
 */
public record SyntaxTree(NodeArena arena, NodeRef<Program> root) {
    public SyntaxTree {
        Objects.requireNonNull(arena, "arena");
        Objects.requireNonNull(root, "root");
        arena.seal();
    }

    public Program program() {
        return arena.get(root);
    }

    public <T extends Node> T resolve(NodeRef<T> ref) {
        return arena.get(ref);
    }
}
