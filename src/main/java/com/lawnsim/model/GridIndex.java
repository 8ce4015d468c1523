package com.lawnsim.model;

import com.lawnsim.util.Geometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Row x column occupancy index. Each cell holds at most one regular plant id
 * and, separately, at most one overlay plant id (a pumpkin around it).
 */
public class GridIndex {
    public static final int EMPTY = -1;

    private final int rows;
    private final int cols;
    private final int[][] cells;
    private final int[][] overlays;

    public GridIndex(int rows, int cols) {
        this.rows = rows;
        this.cols = cols;
        this.cells = new int[rows][cols];
        this.overlays = new int[rows][cols];
        clear();
    }

    public int getRows() { return rows; }
    public int getCols() { return cols; }

    public boolean inBounds(int row, int col) {
        return Geometry.isValidCell(row, col, rows, cols);
    }

    public void insert(int id, int row, int col, boolean overlay) {
        int[][] layer = overlay ? overlays : cells;
        if (layer[row][col] != EMPTY) {
            throw new IllegalStateException("cell " + row + "," + col + " already holds plant " + layer[row][col]);
        }
        layer[row][col] = id;
    }

    public void remove(int id, int row, int col) {
        if (cells[row][col] == id) {
            cells[row][col] = EMPTY;
        } else if (overlays[row][col] == id) {
            overlays[row][col] = EMPTY;
        }
    }

    public int get(int row, int col) {
        return cells[row][col];
    }

    public int getOverlay(int row, int col) {
        return overlays[row][col];
    }

    /** Every plant id in the cell, overlay first. */
    public List<Integer> idsAt(int row, int col) {
        List<Integer> ids = new ArrayList<>(2);
        if (overlays[row][col] != EMPTY) ids.add(overlays[row][col]);
        if (cells[row][col] != EMPTY) ids.add(cells[row][col]);
        return ids;
    }

    public boolean isEmpty(int row, int col) {
        return cells[row][col] == EMPTY && overlays[row][col] == EMPTY;
    }

    public void clear() {
        for (int r = 0; r < rows; r++) {
            Arrays.fill(cells[r], EMPTY);
            Arrays.fill(overlays[r], EMPTY);
        }
    }

    public GridIndex copy() {
        GridIndex clone = new GridIndex(rows, cols);
        for (int r = 0; r < rows; r++) {
            System.arraycopy(cells[r], 0, clone.cells[r], 0, cols);
            System.arraycopy(overlays[r], 0, clone.overlays[r], 0, cols);
        }
        return clone;
    }
}
