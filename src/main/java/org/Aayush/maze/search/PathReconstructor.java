package org.Aayush.maze.search;

import lombok.experimental.UtilityClass;
import org.Aayush.maze.core.MazeException;
import org.Aayush.maze.grid.Cell;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rebuilds a start-to-end path by walking predecessor links back from the end cell.
 */
@UtilityClass
public final class PathReconstructor {

    /**
     * Walks {@code parents} from {@code end} to the root and returns the path in forward order.
     *
     * @param parents links produced by a search that reached {@code end}.
     * @param end last cell of the path.
     * @return path whose first cell is the search root and last cell is {@code end}.
     * @throws MazeException {@code MAZE_PARENT_MISSING} when {@code end} or one of its ancestors
     *         is absent, {@code MAZE_PARENT_CYCLE} when the links never reach a root.
     */
    public static MazePath reconstruct(ParentMap parents, Cell end) {
        Objects.requireNonNull(parents, "parents");
        Objects.requireNonNull(end, "end");

        List<Cell> reversed = new ArrayList<>();
        Optional<Cell> cursor = Optional.of(end);
        while (cursor.isPresent()) {
            Cell cell = cursor.get();
            reversed.add(cell);
            cursor = parents.predecessorOf(cell);
            if (cursor.isPresent() && reversed.size() > parents.size()) {
                throw new MazeException(
                        MazeException.REASON_PARENT_CYCLE,
                        "parent links from " + end + " do not terminate at a root"
                );
            }
        }
        Collections.reverse(reversed);
        return MazePath.of(reversed);
    }
}
