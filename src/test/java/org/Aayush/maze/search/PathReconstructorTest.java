package org.Aayush.maze.search;

import org.Aayush.maze.core.MazeException;
import org.Aayush.maze.grid.Cell;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Path Reconstruction Tests")
class PathReconstructorTest {

    @Test
    @DisplayName("Walks parent links back to the root")
    void testReconstruct() {
        ParentMap parents = new ParentMap(3, 3);
        parents.recordRoot(new Cell(0, 0));
        parents.record(new Cell(0, 1), new Cell(0, 0));
        parents.record(new Cell(1, 1), new Cell(0, 1));
        parents.record(new Cell(1, 0), new Cell(0, 0));

        MazePath path = PathReconstructor.reconstruct(parents, new Cell(1, 1));
        assertEquals(List.of(new Cell(0, 0), new Cell(0, 1), new Cell(1, 1)), path.cells());
        assertEquals(2, path.length());
    }

    @Test
    @DisplayName("Root alone reconstructs to a single-cell path")
    void testRootOnly() {
        ParentMap parents = new ParentMap(2, 2);
        parents.recordRoot(new Cell(1, 1));
        assertEquals(List.of(new Cell(1, 1)), PathReconstructor.reconstruct(parents, new Cell(1, 1)).cells());
    }

    @Test
    @DisplayName("Misuse: end never reached raises MAZE_PARENT_MISSING")
    void testMissingEnd() {
        ParentMap parents = new ParentMap(3, 3);
        parents.recordRoot(new Cell(0, 0));
        parents.record(new Cell(0, 1), new Cell(0, 0));

        MazeException ex = assertThrows(MazeException.class,
                () -> PathReconstructor.reconstruct(parents, new Cell(2, 2)));
        assertEquals(MazeException.REASON_PARENT_MISSING, ex.reasonCode());
    }

    @Test
    @DisplayName("Misuse: broken ancestor chain raises MAZE_PARENT_MISSING")
    void testMissingAncestor() {
        ParentMap parents = new ParentMap(3, 3);
        parents.record(new Cell(0, 1), new Cell(0, 0));

        MazeException ex = assertThrows(MazeException.class,
                () -> PathReconstructor.reconstruct(parents, new Cell(0, 1)));
        assertEquals(MazeException.REASON_PARENT_MISSING, ex.reasonCode());
    }

    @Test
    @DisplayName("Links without a root raise MAZE_PARENT_CYCLE")
    void testCycle() {
        ParentMap parents = new ParentMap(2, 1);
        parents.record(new Cell(0, 0), new Cell(0, 1));
        parents.record(new Cell(0, 1), new Cell(0, 0));

        MazeException ex = assertThrows(MazeException.class,
                () -> PathReconstructor.reconstruct(parents, new Cell(0, 0)));
        assertEquals(MazeException.REASON_PARENT_CYCLE, ex.reasonCode());
    }

    @Test
    @DisplayName("ParentMap models the root as an empty predecessor")
    void testParentMapRoot() {
        ParentMap parents = new ParentMap(4, 4);
        parents.recordRoot(new Cell(2, 3));
        parents.record(new Cell(3, 3), new Cell(2, 3));

        assertEquals(Optional.empty(), parents.predecessorOf(new Cell(2, 3)));
        assertEquals(Optional.of(new Cell(2, 3)), parents.predecessorOf(new Cell(3, 3)));
        assertTrue(parents.contains(new Cell(3, 3)));
        assertFalse(parents.contains(new Cell(0, 0)));
        assertFalse(parents.contains(new Cell(9, 9)));
        assertThrows(MazeException.class, () -> parents.predecessorOf(new Cell(9, 9)));

        ParentMap copy = parents.copy();
        parents.record(new Cell(1, 3), new Cell(2, 3));
        assertEquals(2, copy.size());
        assertEquals(3, parents.size());
    }

    @Test
    @DisplayName("Empty cell list is not a path")
    void testEmptyPath() {
        assertThrows(IllegalArgumentException.class, () -> MazePath.of(List.of()));
    }
}
