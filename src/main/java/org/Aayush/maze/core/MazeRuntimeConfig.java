package org.Aayush.maze.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.maze.grid.Cell;

/**
 * Startup configuration for one maze instance.
 */
@Value
@Builder
public class MazeRuntimeConfig {
    public static final int DEFAULT_SIZE = 20;

    public static final String PROP_WIDTH = "maze.width";
    public static final String PROP_HEIGHT = "maze.height";
    public static final String PROP_START_ROW = "maze.start.row";
    public static final String PROP_START_COL = "maze.start.col";
    public static final String PROP_END_ROW = "maze.end.row";
    public static final String PROP_END_COL = "maze.end.col";
    public static final String PROP_SEED = "maze.seed";

    /** Number of columns. */
    int width;
    /** Number of rows. */
    int height;
    /** Start row, 0-based. */
    int startRow;
    /** Start column, 0-based. */
    int startCol;
    /** End row; null selects the bottom row. */
    Integer endRow;
    /** End column; null selects the rightmost column. */
    Integer endCol;
    /** Generation seed; null draws a fresh one. */
    Long seed;

    /**
     * Default 20x20 maze from the top-left to the bottom-right corner, unseeded.
     */
    public static MazeRuntimeConfig defaults() {
        return MazeRuntimeConfig.builder()
                .width(DEFAULT_SIZE)
                .height(DEFAULT_SIZE)
                .build();
    }

    /**
     * Reads {@code maze.*} system properties. Missing, blank or unparsable values keep the
     * {@link #defaults()} value.
     */
    public static MazeRuntimeConfig fromSystemProperties() {
        MazeRuntimeConfig defaults = defaults();
        return MazeRuntimeConfig.builder()
                .width(readInt(PROP_WIDTH, defaults.getWidth()))
                .height(readInt(PROP_HEIGHT, defaults.getHeight()))
                .startRow(readInt(PROP_START_ROW, defaults.getStartRow()))
                .startCol(readInt(PROP_START_COL, defaults.getStartCol()))
                .endRow(readOptionalInt(PROP_END_ROW))
                .endCol(readOptionalInt(PROP_END_COL))
                .seed(readOptionalLong(PROP_SEED))
                .build();
    }

    public Cell start() {
        return new Cell(startRow, startCol);
    }

    /**
     * Resolves the end cell, filling unset coordinates from the bottom-right corner.
     */
    public Cell end() {
        int row = endRow != null ? endRow : height - 1;
        int col = endCol != null ? endCol : width - 1;
        return new Cell(row, col);
    }

    private static int readInt(String property, int fallback) {
        Integer value = readOptionalInt(property);
        return value != null ? value : fallback;
    }

    private static Integer readOptionalInt(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static Long readOptionalLong(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
