package org.Aayush.maze.search;

import org.Aayush.maze.grid.Cell;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Resumable breadth-first search: one dequeue per {@link #advance()}.
 * <p>
 * Each call dequeues the next cell and returns a {@link SearchStep} snapshot before that cell's
 * neighbors are expanded. The expansion runs when the caller resumes, i.e. on the next
 * {@link #hasNext()} or {@link #advance()}. When the dequeued cell is the end cell the step is
 * still yielded, flagged {@link SearchStep#isEndReached()}, and the search stops without
 * expanding it.
 * </p>
 * <p>
 * The dequeue sequence is identical to {@link PathFinder#solve}; both run on the same
 * {@link SearchFrontier}. Stopping early needs no cleanup.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe.
 * </p>
 */
public final class StepwiseSearch implements Iterator<SearchStep> {
    private final SearchFrontier frontier;

    // Dequeued cell whose expansion is deferred until the caller resumes.
    private Cell pending;
    private SearchStep lastStep;
    private boolean endReached;
    private int steps;

    StepwiseSearch(SearchFrontier frontier) {
        this.frontier = frontier;
    }

    /**
     * Returns whether another step can be taken. Performs the deferred expansion of the
     * previously yielded cell, if any.
     */
    @Override
    public boolean hasNext() {
        settlePending();
        return !endReached && frontier.hasNext();
    }

    /**
     * Dequeues one cell and yields its snapshot.
     *
     * @throws NoSuchElementException when the end was already yielded or the frontier is empty.
     */
    public SearchStep advance() {
        if (!hasNext()) {
            throw new NoSuchElementException("search is complete with status " + status());
        }
        Cell current = frontier.poll();
        steps++;
        if (frontier.isEnd(current)) {
            endReached = true;
        } else {
            pending = current;
        }
        lastStep = SearchStep.builder()
                .index(steps)
                .current(current)
                .endReached(endReached)
                .visited(frontier.visited().copy())
                .parents(frontier.parents().copy())
                .build();
        return lastStep;
    }

    @Override
    public SearchStep next() {
        return advance();
    }

    /**
     * Current progress. May perform the deferred expansion, like {@link #hasNext()}.
     */
    public SearchStatus status() {
        if (endReached) {
            return SearchStatus.FOUND;
        }
        return hasNext() ? SearchStatus.IN_PROGRESS : SearchStatus.NOT_FOUND;
    }

    public Optional<SearchStep> lastStep() {
        return Optional.ofNullable(lastStep);
    }

    /**
     * @return number of steps yielded so far.
     */
    public int steps() {
        return steps;
    }

    public Cell start() {
        return frontier.start();
    }

    public Cell end() {
        return frontier.end();
    }

    /**
     * Returns the shortest path once the end has been yielded, otherwise empty.
     */
    public Optional<MazePath> path() {
        if (!endReached) {
            return Optional.empty();
        }
        return Optional.of(PathReconstructor.reconstruct(frontier.parents(), frontier.end()));
    }

    private void settlePending() {
        if (pending != null) {
            frontier.expand(pending);
            pending = null;
        }
    }
}
