package org.Aayush.maze.core;

import org.Aayush.maze.generation.GenerationTelemetry;
import org.Aayush.maze.grid.Cell;
import org.Aayush.maze.grid.Grid;
import org.Aayush.maze.grid.GridView;
import org.Aayush.maze.search.MazePath;
import org.Aayush.maze.search.SearchResult;
import org.Aayush.maze.search.SearchStatus;
import org.Aayush.maze.search.SearchStep;
import org.Aayush.maze.search.StepwiseSearch;
import org.Aayush.maze.testutil.MazeFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Maze Instance Tests")
class MazeTest {

    @Test
    @DisplayName("Corner factory places end at the bottom-right")
    void testCorners() {
        Maze maze = Maze.withCorners(7, 4);
        assertEquals(7, maze.width());
        assertEquals(4, maze.height());
        assertEquals(new Cell(0, 0), maze.start());
        assertEquals(new Cell(3, 6), maze.end());
        assertFalse(maze.isGenerated());
        assertTrue(maze.generationTelemetry().isEmpty());
    }

    @Test
    @DisplayName("Endpoints outside the grid are rejected at construction")
    void testEndpointValidation() {
        MazeException ex = assertThrows(MazeException.class,
                () -> new Maze(3, 3, new Cell(0, 0), new Cell(3, 3)));
        assertEquals(MazeException.REASON_ENDPOINT_OUT_OF_BOUNDS, ex.reasonCode());

        ex = assertThrows(MazeException.class, () -> new Maze(3, 3, new Cell(0, -1), new Cell(2, 2)));
        assertEquals(MazeException.REASON_ENDPOINT_OUT_OF_BOUNDS, ex.reasonCode());

        ex = assertThrows(MazeException.class, () -> Maze.withCorners(0, 3));
        assertEquals(MazeException.REASON_INVALID_DIMENSIONS, ex.reasonCode());
    }

    @Test
    @DisplayName("Generate once, solve many times")
    void testLifecycle() {
        Maze maze = Maze.withCorners(12, 9);
        GenerationTelemetry telemetry = maze.generate(31L);

        assertTrue(maze.isGenerated());
        assertEquals(12 * 9 - 1, telemetry.getPassagesOpened());
        assertSame(telemetry, maze.generationTelemetry().orElseThrow());

        MazeException ex = assertThrows(MazeException.class, () -> maze.generate(new Random(1L)));
        assertEquals(MazeException.REASON_ALREADY_GENERATED, ex.reasonCode());

        SearchResult first = maze.solve();
        SearchResult second = maze.solve();
        assertTrue(first.isReachable());
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Grid view is read-only and reflects the carved layout")
    void testGridView() {
        Maze maze = Maze.withCorners(5, 5);
        maze.generate(4L);
        GridView view = maze.grid();

        assertFalse(view instanceof Grid);
        assertEquals(5, view.width());
        assertEquals(25, MazeFixtures.reachableCount(view, maze.start()));
        assertTrue(MazeFixtures.wallsSymmetric(view));
    }

    @Test
    @DisplayName("Same seed and endpoints give identical mazes and traversals")
    void testDeterminism() {
        Maze first = new Maze(10, 6, new Cell(2, 3), new Cell(5, 0));
        Maze second = new Maze(10, 6, new Cell(2, 3), new Cell(5, 0));
        first.generate(555L);
        second.generate(555L);

        assertArrayEquals(MazeFixtures.wallSnapshot(first.grid()), MazeFixtures.wallSnapshot(second.grid()));
        assertEquals(first.solve(), second.solve());
    }

    @Test
    @DisplayName("Observer loop: step to end, then reconstruct from the snapshot")
    void testObserverLoop() {
        Maze maze = Maze.withCorners(8, 8);
        maze.generate(12L);

        StepwiseSearch search = maze.stepwise();
        SearchStep last = null;
        while (search.hasNext()) {
            last = search.advance();
            if (last.getCurrent().equals(maze.end())) {
                break;
            }
        }

        assertNotNull(last);
        assertTrue(last.isEndReached());
        assertEquals(SearchStatus.FOUND, search.status());
        MazePath observed = maze.reconstructPath(last.getParents());
        assertEquals(maze.solve().getShortestPath(), observed);
        assertEquals(maze.solve().getExpandedCells(), search.steps());
    }

    @Test
    @DisplayName("Reconstructing from an early snapshot is misuse")
    void testReconstructTooEarly() {
        Maze maze = Maze.withCorners(6, 6);
        maze.generate(2L);
        SearchStep first = maze.stepwise().advance();

        MazeException ex = assertThrows(MazeException.class, () -> maze.reconstructPath(first.getParents()));
        assertEquals(MazeException.REASON_PARENT_MISSING, ex.reasonCode());
    }

    @Test
    @DisplayName("Solving before generation reports no path")
    void testSolveUncarved() {
        Maze maze = Maze.withCorners(3, 3);
        assertFalse(maze.solve().isReachable());
    }

    @Test
    @DisplayName("Created from runtime config")
    void testFromConfig() {
        MazeRuntimeConfig config = MazeRuntimeConfig.builder()
                .width(6)
                .height(4)
                .startRow(1)
                .startCol(2)
                .endRow(0)
                .build();
        Maze maze = Maze.create(config);
        assertEquals(new Cell(1, 2), maze.start());
        assertEquals(new Cell(0, 5), maze.end());
    }
}
