package org.Aayush.maze.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.maze.grid.Cell;

import java.util.Objects;

/**
 * Maze contract exception with deterministic reason codes.
 *
 * <p>Raised for structural misuse only. An unreachable end cell is a normal search outcome
 * and is never reported through this type.</p>
 */
@Getter
@Accessors(fluent = true)
public final class MazeException extends RuntimeException {
    public static final String REASON_CELL_OUT_OF_BOUNDS = "MAZE_CELL_OUT_OF_BOUNDS";
    public static final String REASON_PARENT_MISSING = "MAZE_PARENT_MISSING";
    public static final String REASON_PARENT_CYCLE = "MAZE_PARENT_CYCLE";
    public static final String REASON_INVALID_DIMENSIONS = "MAZE_INVALID_DIMENSIONS";
    public static final String REASON_ENDPOINT_OUT_OF_BOUNDS = "MAZE_ENDPOINT_OUT_OF_BOUNDS";
    public static final String REASON_ALREADY_GENERATED = "MAZE_ALREADY_GENERATED";

    private final String reasonCode;

    /**
     * Creates a reason-coded maze contract failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public MazeException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Builds the out-of-bounds failure for a cell addressed against a {@code width x height} grid.
     */
    public static MazeException cellOutOfBounds(Cell cell, int width, int height) {
        return new MazeException(
                REASON_CELL_OUT_OF_BOUNDS,
                "cell " + cell + " outside grid of " + height + " rows x " + width + " cols"
        );
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
