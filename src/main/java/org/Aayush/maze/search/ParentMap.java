package org.Aayush.maze.search;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.maze.core.MazeException;
import org.Aayush.maze.grid.Cell;

import java.util.Optional;

/**
 * BFS predecessor links: visited cell to the cell it was discovered from.
 * <p>
 * The search root maps to "no predecessor", surfaced as {@link Optional#empty()}. Storage is a
 * fastutil int map over row-major cell indices; the root sentinel never leaves this class.
 * </p>
 * <p>
 * Mutation is package-private and only performed by the search that owns the map.
 * </p>
 */
public final class ParentMap {
    private static final int NO_PREDECESSOR = -1;
    private static final int ABSENT = -2;

    @Getter
    @Accessors(fluent = true)
    private final int width;
    @Getter
    @Accessors(fluent = true)
    private final int height;

    private final Int2IntOpenHashMap links;

    ParentMap(int width, int height) {
        this(width, height, new Int2IntOpenHashMap());
    }

    private ParentMap(int width, int height, Int2IntOpenHashMap links) {
        this.width = width;
        this.height = height;
        this.links = links;
        this.links.defaultReturnValue(ABSENT);
    }

    void recordRoot(Cell root) {
        links.put(encode(root), NO_PREDECESSOR);
    }

    void record(Cell child, Cell parent) {
        links.put(encode(child), encode(parent));
    }

    /**
     * Returns whether {@code cell} was reached by the search.
     */
    public boolean contains(Cell cell) {
        return inBounds(cell) && links.containsKey(cell.row() * width + cell.col());
    }

    /**
     * Returns the predecessor of {@code cell}, or empty for the search root.
     *
     * @throws MazeException with reason {@code MAZE_PARENT_MISSING} when the cell was never reached.
     */
    public Optional<Cell> predecessorOf(Cell cell) {
        int parent = inBounds(cell) ? links.get(cell.row() * width + cell.col()) : ABSENT;
        if (parent == ABSENT) {
            throw new MazeException(
                    MazeException.REASON_PARENT_MISSING,
                    "no parent link recorded for " + cell
            );
        }
        if (parent == NO_PREDECESSOR) {
            return Optional.empty();
        }
        return Optional.of(new Cell(parent / width, parent % width));
    }

    /**
     * @return number of reached cells, root included.
     */
    public int size() {
        return links.size();
    }

    /**
     * Returns an independent copy of the current links.
     */
    public ParentMap copy() {
        return new ParentMap(width, height, new Int2IntOpenHashMap(links));
    }

    private int encode(Cell cell) {
        if (!inBounds(cell)) {
            throw MazeException.cellOutOfBounds(cell, width, height);
        }
        return cell.row() * width + cell.col();
    }

    private boolean inBounds(Cell cell) {
        return cell.row() >= 0 && cell.row() < height && cell.col() >= 0 && cell.col() < width;
    }
}
