package com.tinypy.script.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Indentation columns of the open blocks, strictly increasing from the bottom. The base
 * level (column 1) is never popped.
 */
final class IndentStack {
    static final int BASE_LEVEL = 1;

    private final List<Integer> levels = new ArrayList<>();

    IndentStack() {
        levels.add(BASE_LEVEL);
    }

    int top() {
        return levels.get(levels.size() - 1);
    }

    void push(int level) {
        if (level <= top()) {
            throw new IllegalStateException("indent level " + level + " not above " + top());
        }
        levels.add(level);
    }

    int pop() {
        if (levels.size() == 1) throw new IllegalStateException("cannot pop the base level");
        return levels.remove(levels.size() - 1);
    }

    boolean contains(int level) {
        return levels.contains(level);
    }

    /** Number of open blocks above the base level. */
    int depth() {
        return levels.size() - 1;
    }

    @Override
    public String toString() {
        return levels.toString();
    }
}
