package org.Aayush.maze.app;

import org.Aayush.maze.core.Maze;
import org.Aayush.maze.core.MazeRuntimeConfig;
import org.Aayush.maze.generation.GenerationTelemetry;
import org.Aayush.maze.search.SearchResult;
import org.Aayush.maze.search.SearchStep;
import org.Aayush.maze.search.StepwiseSearch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Command-line entry point used for local smoke runs.
 *
 * <p>Usage: {@code Main [width height [seed]]}. Arguments that are not given come from
 * {@code maze.*} system properties, then from the defaults.</p>
 */
public class Main {

    /**
     * Generates one maze, drives a stepwise search to the end and prints a summary.
     *
     * @param args optional {@code width height [seed]}.
     */
    public static void main(String[] args) {
        MazeRuntimeConfig config = applyArguments(MazeRuntimeConfig.fromSystemProperties(), args);
        long seed = config.getSeed() != null ? config.getSeed() : ThreadLocalRandom.current().nextLong();

        Maze maze = Maze.create(config);
        GenerationTelemetry generation = maze.generate(seed);
        System.out.println("maze " + maze.height() + "x" + maze.width() + " seed=" + seed
                + " start=" + maze.start() + " end=" + maze.end());
        System.out.println("passages=" + generation.getPassagesOpened()
                + " backtracks=" + generation.getBacktracks()
                + " maxStackDepth=" + generation.getMaxStackDepth());

        StepwiseSearch search = maze.stepwise();
        SearchStep last = null;
        while (search.hasNext()) {
            last = search.advance();
        }

        if (last != null && last.isEndReached()) {
            System.out.println("steps=" + search.steps()
                    + " path=" + maze.reconstructPath(last.getParents()).cells());
        } else {
            System.out.println("steps=" + search.steps() + " no path found");
        }

        SearchResult check = maze.solve();
        System.out.println("shortestPathLength=" + check.path().map(p -> String.valueOf(p.length())).orElse("none"));
    }

    static MazeRuntimeConfig applyArguments(MazeRuntimeConfig base, String[] args) {
        if (args.length < 2) {
            return base;
        }
        MazeRuntimeConfig.MazeRuntimeConfigBuilder builder = MazeRuntimeConfig.builder()
                .width(Integer.parseInt(args[0]))
                .height(Integer.parseInt(args[1]))
                .startRow(base.getStartRow())
                .startCol(base.getStartCol())
                .endRow(base.getEndRow())
                .endCol(base.getEndCol())
                .seed(base.getSeed());
        if (args.length >= 3) {
            builder.seed(Long.parseLong(args[2]));
        }
        return builder.build();
    }
}
