package org.Aayush.maze.grid;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.maze.core.MazeException;

import java.util.BitSet;

/**
 * A {@code height x width} visitation marker backed by a {@link BitSet}.
 * <p>
 * One instance belongs to exactly one traversal. There is no reset: every traversal
 * allocates its own matrix.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe.
 * </p>
 */
public final class VisitedMatrix {

    @Getter
    @Accessors(fluent = true)
    private final int width;
    @Getter
    @Accessors(fluent = true)
    private final int height;

    private final BitSet visited;

    /**
     * Constructs an all-unvisited matrix.
     *
     * @param width number of columns.
     * @param height number of rows.
     */
    public VisitedMatrix(int width, int height) {
        this(width, height, new BitSet(width * height));
    }

    private VisitedMatrix(int width, int height, BitSet visited) {
        this.width = width;
        this.height = height;
        this.visited = visited;
    }

    /**
     * Marks a cell as visited if it hasn't been visited already.
     *
     * @param cell cell to mark.
     * @return {@code true} if the cell was NOT previously visited.
     * @throws MazeException with reason {@code MAZE_CELL_OUT_OF_BOUNDS} for cells outside the matrix.
     */
    public boolean markVisited(Cell cell) {
        int index = index(cell);
        if (visited.get(index)) {
            return false;
        }
        visited.set(index);
        return true;
    }

    /**
     * Checks if a cell has been visited.
     *
     * @throws MazeException with reason {@code MAZE_CELL_OUT_OF_BOUNDS} for cells outside the matrix.
     */
    public boolean isVisited(Cell cell) {
        return visited.get(index(cell));
    }

    /**
     * @return number of cells currently marked.
     */
    public int visitedCount() {
        return visited.cardinality();
    }

    /**
     * Returns an independent copy; later marks on either instance are not shared.
     */
    public VisitedMatrix copy() {
        return new VisitedMatrix(width, height, (BitSet) visited.clone());
    }

    /**
     * Exports the marks as a fresh {@code [row][col]} array.
     */
    public boolean[][] toArray() {
        boolean[][] rows = new boolean[height][width];
        for (int index = visited.nextSetBit(0); index >= 0; index = visited.nextSetBit(index + 1)) {
            rows[index / width][index % width] = true;
        }
        return rows;
    }

    private int index(Cell cell) {
        if (cell.row() < 0 || cell.row() >= height || cell.col() < 0 || cell.col() >= width) {
            throw MazeException.cellOutOfBounds(cell, width, height);
        }
        return cell.row() * width + cell.col();
    }
}
