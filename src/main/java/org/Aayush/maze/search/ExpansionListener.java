package org.Aayush.maze.search;

import org.Aayush.maze.grid.Cell;

/**
 * Receives every cell dequeued by a synchronous solve, in dequeue order.
 */
@FunctionalInterface
public interface ExpansionListener {

    /** Listener that ignores all events. */
    ExpansionListener NONE = cell -> {
    };

    void onDequeue(Cell cell);
}
