package org.Aayush.maze.search;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of a synchronous solve.
 *
 * <p>When {@code reachable=false} there is no path; this is a normal outcome, not an error.</p>
 */
@Value
@Builder
public class SearchResult {
    /** Whether the end cell was reached. */
    boolean reachable;
    /** Number of dequeued cells, the end cell included. */
    int expandedCells;
    /** Shortest path; null when unreachable. */
    MazePath shortestPath;

    static SearchResult found(MazePath path, int expandedCells) {
        return SearchResult.builder()
                .reachable(true)
                .expandedCells(expandedCells)
                .shortestPath(path)
                .build();
    }

    static SearchResult notFound(int expandedCells) {
        return SearchResult.builder()
                .reachable(false)
                .expandedCells(expandedCells)
                .build();
    }

    /**
     * Returns the shortest path, or empty when the end cell is unreachable.
     */
    public Optional<MazePath> path() {
        return Optional.ofNullable(shortestPath);
    }
}
