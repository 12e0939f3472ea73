package org.Aayush.maze.search;

import org.Aayush.maze.grid.Cell;
import org.Aayush.maze.grid.GridView;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Breadth-first shortest-path search over the passage graph of a grid.
 * <p>
 * Two cells are adjacent when they are grid neighbors with no wall between them. The graph is
 * unweighted, so the first time BFS dequeues the end cell its parent chain is a minimum-edge
 * path. Traversal order is fully determined by the grid, the endpoints and {@code Direction}
 * order.
 * </p>
 * <p>
 * Each call allocates its own visited matrix and parent map; the finder itself holds no search
 * state and the grid is only read.
 * </p>
 */
public final class PathFinder {
    private static final Logger LOGGER = Logger.getLogger(PathFinder.class.getName());

    private final GridView grid;

    /**
     * @param grid carved grid to search.
     */
    public PathFinder(GridView grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    /**
     * Runs the search to completion.
     *
     * @throws org.Aayush.maze.core.MazeException with reason {@code MAZE_CELL_OUT_OF_BOUNDS}
     *         when an endpoint lies outside the grid.
     */
    public SearchResult solve(Cell start, Cell end) {
        return solve(start, end, ExpansionListener.NONE);
    }

    /**
     * Runs the search to completion, reporting every dequeued cell to {@code listener}.
     */
    public SearchResult solve(Cell start, Cell end, ExpansionListener listener) {
        Objects.requireNonNull(listener, "listener");
        SearchFrontier frontier = new SearchFrontier(grid, start, end);
        int expanded = 0;
        while (frontier.hasNext()) {
            Cell current = frontier.poll();
            expanded++;
            listener.onDequeue(current);
            if (frontier.isEnd(current)) {
                MazePath path = PathReconstructor.reconstruct(frontier.parents(), end);
                int dequeued = expanded;
                LOGGER.fine(() -> "path " + start + " -> " + end + " found: length=" + path.length()
                        + ", dequeued=" + dequeued);
                return SearchResult.found(path, expanded);
            }
            frontier.expand(current);
        }
        int dequeued = expanded;
        LOGGER.fine(() -> "no path " + start + " -> " + end + " after " + dequeued + " dequeues");
        return SearchResult.notFound(expanded);
    }

    /**
     * Convenience form of {@link #solve(Cell, Cell)} returning only the path.
     */
    public Optional<MazePath> findPath(Cell start, Cell end) {
        return solve(start, end).path();
    }

    /**
     * Starts a search that advances one dequeue per caller request.
     */
    public StepwiseSearch stepwise(Cell start, Cell end) {
        return new StepwiseSearch(new SearchFrontier(grid, start, end));
    }
}
