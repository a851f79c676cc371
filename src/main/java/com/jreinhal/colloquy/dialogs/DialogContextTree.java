package com.jreinhal.colloquy.dialogs;

import com.jreinhal.colloquy.dialogs.memory.MemoryScopes;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The contexts created during one turn, kept as a flat list with the index of each
 * context's parent. Contexts refer to each other through their index only.
 */
final class DialogContextTree {
    static final int ROOT = -1;

    private final List<DialogContext> nodes = new ArrayList<>();
    private final List<Integer> parents = new ArrayList<>();
    private final Map<Integer, Child> children = new HashMap<>();
    private final MemoryScopes memoryScopes;

    DialogContextTree(MemoryScopes memoryScopes) {
        this.memoryScopes = memoryScopes;
    }

    int register(DialogContext context, int parentIndex) {
        this.nodes.add(context);
        this.parents.add(parentIndex);
        return this.nodes.size() - 1;
    }

    DialogContext parentOf(int index) {
        int parent = this.parents.get(index);
        return parent == ROOT ? null : this.nodes.get(parent);
    }

    /**
     * The child context last created under {@code parentIndex}, provided the frame that owns
     * it is still the active one.
     */
    DialogContext cachedChild(int parentIndex, DialogInstance owner) {
        Child child = this.children.get(parentIndex);
        return child != null && child.owner() == owner ? child.context() : null;
    }

    void cacheChild(int parentIndex, DialogInstance owner, DialogContext context) {
        this.children.put(parentIndex, new Child(owner, context));
    }

    MemoryScopes memoryScopes() {
        return this.memoryScopes;
    }

    private record Child(DialogInstance owner, DialogContext context) {
    }
}
