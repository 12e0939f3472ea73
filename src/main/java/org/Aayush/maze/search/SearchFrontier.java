package org.Aayush.maze.search;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.maze.core.MazeException;
import org.Aayush.maze.grid.Cell;
import org.Aayush.maze.grid.Direction;
import org.Aayush.maze.grid.GridView;
import org.Aayush.maze.grid.VisitedMatrix;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * State of one breadth-first search plus its single expansion rule.
 * <p>
 * Both the synchronous solver and the stepwise driver run on this class, so they dequeue the
 * same cells in the same order. Neighbors are enqueued in {@link Direction} order and the queue
 * is strict FIFO.
 * </p>
 */
final class SearchFrontier {
    private static final Direction[] DIRECTIONS = Direction.values();

    private final GridView grid;
    @Getter
    @Accessors(fluent = true)
    private final Cell start;
    @Getter
    @Accessors(fluent = true)
    private final Cell end;
    private final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
    @Getter
    @Accessors(fluent = true)
    private final VisitedMatrix visited;
    @Getter
    @Accessors(fluent = true)
    private final ParentMap parents;

    SearchFrontier(GridView grid, Cell start, Cell end) {
        this.grid = grid;
        this.start = requireContained(grid, start);
        this.end = requireContained(grid, end);
        this.visited = new VisitedMatrix(grid.width(), grid.height());
        this.parents = new ParentMap(grid.width(), grid.height());

        visited.markVisited(start);
        parents.recordRoot(start);
        queue.enqueue(grid.indexOf(start));
    }

    boolean hasNext() {
        return !queue.isEmpty();
    }

    /**
     * Pops the head of the queue.
     *
     * @throws NoSuchElementException if the frontier is empty.
     */
    Cell poll() {
        if (queue.isEmpty()) {
            throw new NoSuchElementException("frontier is empty");
        }
        return grid.cellAt(queue.dequeueInt());
    }

    boolean isEnd(Cell cell) {
        return end.equals(cell);
    }

    /**
     * Discovers every in-bounds, unvisited neighbor of {@code current} reachable through an open
     * passage: marks it visited, links it to {@code current} and enqueues it.
     */
    void expand(Cell current) {
        for (Direction direction : DIRECTIONS) {
            Cell neighbor = current.neighbor(direction);
            if (!grid.contains(neighbor) || visited.isVisited(neighbor)) {
                continue;
            }
            if (grid.wallPresent(current, direction)) {
                continue;
            }
            visited.markVisited(neighbor);
            parents.record(neighbor, current);
            queue.enqueue(grid.indexOf(neighbor));
        }
    }

    private static Cell requireContained(GridView grid, Cell cell) {
        Objects.requireNonNull(cell, "search endpoint");
        if (!grid.contains(cell)) {
            throw MazeException.cellOutOfBounds(cell, grid.width(), grid.height());
        }
        return cell;
    }
}
