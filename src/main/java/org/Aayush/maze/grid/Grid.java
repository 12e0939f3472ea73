package org.Aayush.maze.grid;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.maze.core.MazeException;

import java.util.BitSet;

/**
 * Fixed-size wall store: four wall flags per cell, one bit each.
 * <p>
 * Bit layout is {@code (row * width + col) * 4 + direction.ordinal()}; a set bit means the
 * wall is present. A new grid is fully walled.
 * </p>
 * <p>
 * Walls are always removed in pairs, so the flag on one side of a shared wall always equals
 * the flag on the other side.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Generation must complete before the grid is
 * shared with readers.
 * </p>
 */
public final class Grid implements GridView {
    private static final int SIDES = 4;

    @Getter
    @Accessors(fluent = true)
    private final int width;
    @Getter
    @Accessors(fluent = true)
    private final int height;

    private final BitSet walls;

    /**
     * Creates a fully walled grid.
     *
     * @param width number of columns, must be positive.
     * @param height number of rows, must be positive.
     * @throws MazeException with reason {@code MAZE_INVALID_DIMENSIONS} for non-positive sizes.
     */
    public Grid(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new MazeException(
                    MazeException.REASON_INVALID_DIMENSIONS,
                    "grid dimensions must be positive, got " + width + "x" + height
            );
        }
        this.width = width;
        this.height = height;
        int bits = Math.multiplyExact(Math.multiplyExact(width, height), SIDES);
        this.walls = new BitSet(bits);
        this.walls.set(0, bits);
    }

    @Override
    public boolean wallPresent(Cell cell, Direction direction) {
        requireContains(cell);
        return walls.get(bit(cell, direction));
    }

    /**
     * Opens the passage between {@code cell} and its neighbor towards {@code direction},
     * clearing both halves of the shared wall.
     *
     * @throws MazeException with reason {@code MAZE_CELL_OUT_OF_BOUNDS} when either side of the
     *         wall lies outside the grid.
     */
    public void removeWall(Cell cell, Direction direction) {
        Cell neighbor = cell.neighbor(direction);
        requireContains(cell);
        requireContains(neighbor);
        walls.clear(bit(cell, direction));
        walls.clear(bit(neighbor, direction.opposite()));
    }

    /**
     * Number of open passages (edges in the passage graph).
     */
    public int passageCount() {
        int openFlags = cellCount() * SIDES - walls.cardinality();
        return openFlags / 2;
    }

    /**
     * Returns a view that exposes wall queries but cannot be cast back to a mutable grid.
     */
    public GridView readOnlyView() {
        Grid self = this;
        return new GridView() {
            @Override
            public int width() {
                return self.width;
            }

            @Override
            public int height() {
                return self.height;
            }

            @Override
            public boolean wallPresent(Cell cell, Direction direction) {
                return self.wallPresent(cell, direction);
            }
        };
    }

    private void requireContains(Cell cell) {
        if (!contains(cell)) {
            throw MazeException.cellOutOfBounds(cell, width, height);
        }
    }

    private int bit(Cell cell, Direction direction) {
        return indexOf(cell) * SIDES + direction.ordinal();
    }
}
