package org.Aayush.maze.grid;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Wall sides of a cell in fixed cyclic order.
 *
 * <p>Declaration order is the enumeration order used by both generation and search, so
 * traversal order (and therefore tie-breaking) depends on it.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum Direction {
    UP(-1, 0),
    RIGHT(0, 1),
    DOWN(1, 0),
    LEFT(0, -1);

    private static final Direction[] CYCLE = values();

    private final int rowDelta;
    private final int colDelta;

    /**
     * Returns the side facing this one across a shared wall.
     */
    public Direction opposite() {
        return CYCLE[(ordinal() + 2) % CYCLE.length];
    }
}
