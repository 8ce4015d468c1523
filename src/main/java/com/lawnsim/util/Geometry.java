package com.lawnsim.util;

/**
 * Lawn coordinate system. x grows to the right in pixels, rows grow downward.
 * A plant's x is the left edge of its cell.
 */
public final class Geometry {

    public static final int GRID_WIDTH = 80;
    public static final int GRID_HEIGHT = 85;
    public static final int MAX_COLS = 9;
    public static final int MAX_ROWS = 6;

    public static final int LAWN_LEFT_X = 40;
    public static final int LAWN_RIGHT_X = 760;
    public static final int LAWN_TOP_Y = 80;

    // Zombies enter here, past the right edge of the last column
    public static final double ZOMBIE_SPAWN_X = 800;

    private Geometry() {}

    public static double colToX(int col) {
        return LAWN_LEFT_X + col * GRID_WIDTH;
    }

    public static double colToCenterX(int col) {
        return colToX(col) + GRID_WIDTH / 2.0;
    }

    public static int xToCol(double x) {
        int col = (int) Math.floor((x - LAWN_LEFT_X) / GRID_WIDTH);
        return Math.max(0, Math.min(MAX_COLS - 1, col));
    }

    public static double rowToY(int row) {
        return LAWN_TOP_Y + row * GRID_HEIGHT;
    }

    public static double rowToCenterY(int row) {
        return rowToY(row) + GRID_HEIGHT / 2.0;
    }

    public static boolean isValidCell(int row, int col, int rows, int cols) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    public static double distance(double x1, double y1, double x2, double y2) {
        double dx = x2 - x1;
        double dy = y2 - y1;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /** Chebyshev distance in cells. */
    public static int gridDistance(int row1, int col1, int row2, int col2) {
        return Math.max(Math.abs(row1 - row2), Math.abs(col1 - col2));
    }
}
