package com.jreinhal.colloquy.dialogs.memory;

/**
 * A dialog field whose value is computed from memory when the class scopes read it.
 */
@FunctionalInterface
public interface ValueExpression {

    Object evaluate(DialogMemory memory);

    static ValueExpression path(String path) {
        return memory -> memory.getValue(path);
    }
}
