package org.Aayush.maze.generation;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable summary of one maze carving run.
 */
@Value
@Builder
public class GenerationTelemetry {

    /**
     * Cells reached by the carving walk (equals the grid cell count for a full run).
     */
    int visitedCells;

    /**
     * Walls removed; a spanning tree over N cells opens exactly N-1.
     */
    int passagesOpened;

    /**
     * Dead-end pops from the carving stack.
     */
    int backtracks;

    /**
     * Peak carving-stack depth.
     */
    int maxStackDepth;
}
