package org.Aayush.maze.grid;

/**
 * Read-only view of maze wall structure.
 *
 * <p>This is what renderers and searches consume. Dense cell indices are row-major:
 * {@code index = row * width + col}.</p>
 */
public interface GridView {

    /**
     * @return number of columns.
     */
    int width();

    /**
     * @return number of rows.
     */
    int height();

    /**
     * Returns whether the wall on {@code direction} side of {@code cell} is present.
     *
     * @param cell addressed cell.
     * @param direction wall side.
     * @return {@code true} when no passage exists on that side.
     * @throws org.Aayush.maze.core.MazeException with reason
     *         {@code MAZE_CELL_OUT_OF_BOUNDS} when the cell lies outside the grid.
     */
    boolean wallPresent(Cell cell, Direction direction);

    /**
     * Returns whether {@code cell} lies within {@code [0,height) x [0,width)}.
     */
    default boolean contains(Cell cell) {
        return cell.row() >= 0 && cell.row() < height() && cell.col() >= 0 && cell.col() < width();
    }

    /**
     * Returns whether a passage leads out of {@code cell} towards {@code direction}.
     */
    default boolean hasPassage(Cell cell, Direction direction) {
        return !wallPresent(cell, direction);
    }

    default int cellCount() {
        return width() * height();
    }

    default int indexOf(Cell cell) {
        return cell.row() * width() + cell.col();
    }

    default Cell cellAt(int index) {
        return new Cell(index / width(), index % width());
    }
}
