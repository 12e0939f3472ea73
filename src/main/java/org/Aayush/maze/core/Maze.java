package org.Aayush.maze.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.maze.generation.GenerationTelemetry;
import org.Aayush.maze.generation.MazeGenerator;
import org.Aayush.maze.grid.Cell;
import org.Aayush.maze.grid.Grid;
import org.Aayush.maze.grid.GridView;
import org.Aayush.maze.search.MazePath;
import org.Aayush.maze.search.ParentMap;
import org.Aayush.maze.search.PathFinder;
import org.Aayush.maze.search.PathReconstructor;
import org.Aayush.maze.search.SearchResult;
import org.Aayush.maze.search.StepwiseSearch;

import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * One maze instance: dimensions, fixed endpoints and the wall grid.
 * <p>
 * Lifecycle: constructed fully walled, carved once by {@link #generate(Random)}, then read-only.
 * Searches may run any number of times afterwards; each owns its own state.
 * </p>
 */
public final class Maze {

    @Getter
    @Accessors(fluent = true)
    private final int width;
    @Getter
    @Accessors(fluent = true)
    private final int height;
    @Getter
    @Accessors(fluent = true)
    private final Cell start;
    @Getter
    @Accessors(fluent = true)
    private final Cell end;

    private final Grid grid;
    private final GridView view;
    private GenerationTelemetry generation;

    /**
     * Creates a fully walled maze.
     *
     * @throws MazeException {@code MAZE_INVALID_DIMENSIONS} for non-positive sizes,
     *         {@code MAZE_ENDPOINT_OUT_OF_BOUNDS} when start or end lies outside the grid.
     */
    public Maze(int width, int height, Cell start, Cell end) {
        this.grid = new Grid(width, height);
        this.width = width;
        this.height = height;
        this.start = requireEndpoint("start", start);
        this.end = requireEndpoint("end", end);
        this.view = grid.readOnlyView();
    }

    /**
     * Creates a maze from the top-left corner to the bottom-right corner.
     */
    public static Maze withCorners(int width, int height) {
        return new Maze(width, height, new Cell(0, 0), new Cell(height - 1, width - 1));
    }

    /**
     * Creates a maze with the configured dimensions and endpoints.
     */
    public static Maze create(MazeRuntimeConfig config) {
        Objects.requireNonNull(config, "config");
        return new Maze(config.getWidth(), config.getHeight(), config.start(), config.end());
    }

    /**
     * Carves the maze from its start cell.
     *
     * @throws MazeException with reason {@code MAZE_ALREADY_GENERATED} on a second call.
     */
    public GenerationTelemetry generate(Random random) {
        if (generation != null) {
            throw new MazeException(MazeException.REASON_ALREADY_GENERATED, "maze was already generated");
        }
        generation = new MazeGenerator(random).generate(grid, start);
        return generation;
    }

    /**
     * Carves the maze with a deterministic seed.
     */
    public GenerationTelemetry generate(long seed) {
        return generate(new Random(seed));
    }

    public boolean isGenerated() {
        return generation != null;
    }

    /**
     * Returns the telemetry of the carving run, or empty before generation.
     */
    public Optional<GenerationTelemetry> generationTelemetry() {
        return Optional.ofNullable(generation);
    }

    /**
     * Read-only wall structure for renderers.
     */
    public GridView grid() {
        return view;
    }

    /**
     * Solves start to end in one call.
     */
    public SearchResult solve() {
        return new PathFinder(view).solve(start, end);
    }

    /**
     * Starts a stepwise search from start to end.
     */
    public StepwiseSearch stepwise() {
        return new PathFinder(view).stepwise(start, end);
    }

    /**
     * Reconstructs the path to this maze's end cell from a search snapshot.
     *
     * @throws MazeException with reason {@code MAZE_PARENT_MISSING} when the snapshot never
     *         reached the end cell.
     */
    public MazePath reconstructPath(ParentMap parents) {
        return PathReconstructor.reconstruct(parents, end);
    }

    private Cell requireEndpoint(String role, Cell cell) {
        Objects.requireNonNull(cell, role);
        if (!grid.contains(cell)) {
            throw new MazeException(
                    MazeException.REASON_ENDPOINT_OUT_OF_BOUNDS,
                    role + " " + cell + " outside grid of " + height + " rows x " + width + " cols"
            );
        }
        return cell;
    }
}
