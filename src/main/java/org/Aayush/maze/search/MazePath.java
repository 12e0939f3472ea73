package org.Aayush.maze.search;

import lombok.Value;
import lombok.experimental.Accessors;
import org.Aayush.maze.grid.Cell;

import java.util.List;

/**
 * Immutable start-to-end cell sequence, both ends inclusive.
 */
@Value
@Accessors(fluent = true)
public class MazePath {
    List<Cell> cells;

    private MazePath(List<Cell> cells) {
        if (cells.isEmpty()) {
            throw new IllegalArgumentException("path must contain at least one cell");
        }
        this.cells = List.copyOf(cells);
    }

    /**
     * Creates a path from an ordered start-to-end cell list.
     */
    public static MazePath of(List<Cell> cells) {
        return new MazePath(cells);
    }

    public Cell start() {
        return cells.get(0);
    }

    public Cell end() {
        return cells.get(cells.size() - 1);
    }

    /**
     * @return number of passages traversed (cells minus one).
     */
    public int length() {
        return cells.size() - 1;
    }
}
