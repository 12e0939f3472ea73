package org.Aayush.maze.grid;

/**
 * Immutable (row, col) grid coordinate, 0-indexed.
 *
 * <p>Used as graph-node identity and as a map key. A cell carries no bounds of its own;
 * containment is always answered by the {@link GridView} it is used with.</p>
 */
public record Cell(int row, int col) {

    /**
     * Returns the cell one step away in {@code direction}. The result may lie outside any grid.
     */
    public Cell neighbor(Direction direction) {
        return new Cell(row + direction.rowDelta(), col + direction.colDelta());
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
