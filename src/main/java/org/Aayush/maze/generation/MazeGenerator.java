package org.Aayush.maze.generation;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.maze.core.MazeException;
import org.Aayush.maze.grid.Cell;
import org.Aayush.maze.grid.Direction;
import org.Aayush.maze.grid.Grid;
import org.Aayush.maze.grid.VisitedMatrix;

import java.util.Objects;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Carves a perfect maze with randomized iterative depth-first backtracking.
 * <p>
 * The walk keeps an explicit stack of cells. At each step it lists the unvisited in-bounds
 * neighbors of the stack top (UP, RIGHT, DOWN, LEFT order), picks one uniformly at random,
 * removes the shared wall and pushes it; a cell with no such neighbor is popped. Every wall
 * removal connects a visited cell to an unvisited one, so the passage graph stays acyclic,
 * and the walk only ends once every cell has been reached.
 * </p>
 * <p>
 * All randomness comes from the injected {@link Random}; the same seed and grid size always
 * carve the same layout.
 * </p>
 */
public final class MazeGenerator {
    private static final Logger LOGGER = Logger.getLogger(MazeGenerator.class.getName());
    private static final Direction[] DIRECTIONS = Direction.values();

    private final Random random;

    /**
     * @param random randomness source for neighbor selection.
     */
    public MazeGenerator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Creates a generator with a deterministic seed.
     */
    public static MazeGenerator seeded(long seed) {
        return new MazeGenerator(new Random(seed));
    }

    /**
     * Carves {@code grid} into a spanning tree rooted at {@code start}.
     *
     * @param grid fully walled grid; mutated in place.
     * @param start first cell of the carving walk.
     * @return run telemetry.
     * @throws MazeException {@code MAZE_CELL_OUT_OF_BOUNDS} when start lies outside the grid,
     *         {@code MAZE_ALREADY_GENERATED} when the grid already has open passages.
     */
    public GenerationTelemetry generate(Grid grid, Cell start) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(start, "start");
        if (!grid.contains(start)) {
            throw MazeException.cellOutOfBounds(start, grid.width(), grid.height());
        }
        if (grid.passageCount() != 0) {
            throw new MazeException(
                    MazeException.REASON_ALREADY_GENERATED,
                    "grid already has " + grid.passageCount() + " open passages"
            );
        }

        VisitedMatrix visited = new VisitedMatrix(grid.width(), grid.height());
        IntArrayList stack = new IntArrayList();
        // Ordinals of candidate directions for the current stack top.
        IntArrayList candidates = new IntArrayList(DIRECTIONS.length);

        visited.markVisited(start);
        stack.push(grid.indexOf(start));
        int passagesOpened = 0;
        int backtracks = 0;
        int maxStackDepth = 1;

        while (!stack.isEmpty()) {
            Cell current = grid.cellAt(stack.topInt());
            candidates.clear();
            for (Direction direction : DIRECTIONS) {
                Cell neighbor = current.neighbor(direction);
                if (grid.contains(neighbor) && !visited.isVisited(neighbor)) {
                    candidates.add(direction.ordinal());
                }
            }

            if (candidates.isEmpty()) {
                stack.popInt();
                backtracks++;
                continue;
            }

            Direction chosen = DIRECTIONS[candidates.getInt(random.nextInt(candidates.size()))];
            Cell next = current.neighbor(chosen);
            grid.removeWall(current, chosen);
            visited.markVisited(next);
            stack.push(grid.indexOf(next));
            passagesOpened++;
            maxStackDepth = Math.max(maxStackDepth, stack.size());
        }

        GenerationTelemetry telemetry = GenerationTelemetry.builder()
                .visitedCells(visited.visitedCount())
                .passagesOpened(passagesOpened)
                .backtracks(backtracks)
                .maxStackDepth(maxStackDepth)
                .build();
        LOGGER.fine(() -> "carved " + grid.height() + "x" + grid.width() + " maze from " + start + ": " + telemetry);
        return telemetry;
    }
}
