package org.Aayush.maze.search;

import lombok.Builder;
import lombok.Value;
import org.Aayush.maze.grid.Cell;
import org.Aayush.maze.grid.VisitedMatrix;

/**
 * State yielded by one resumption of a {@link StepwiseSearch}.
 *
 * <p>The snapshot is taken right after {@code current} is dequeued and before its neighbors
 * are expanded. {@code visited} and {@code parents} are private copies and stay unchanged as
 * the search continues.</p>
 */
@Value
@Builder
public class SearchStep {
    /** 1-based dequeue ordinal. */
    int index;
    /** Cell just dequeued. */
    Cell current;
    /** Whether {@code current} is the search end cell; no further steps follow. */
    boolean endReached;
    /** Visitation marks at yield time. */
    VisitedMatrix visited;
    /** Predecessor links at yield time. */
    ParentMap parents;
}
