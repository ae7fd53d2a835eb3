package org.ionresults.datapipeline.api.model;

import java.util.Arrays;

/**
 * The pixel sampling grid of a dataset.
 * <p>
 * Defines the coordinate space of every isotope image of a job. A pixel is "sampled"
 * when the instrument acquired a spectrum at that position; unsampled pixels are rendered
 * transparent by image stores. Instances are immutable and safe to share across worker threads.
 */
public final class SpatialMask {

    private final int rows;
    private final int cols;
    private final boolean[] sampled;   // row-major
    private final int sampledCount;

    private SpatialMask(int rows, int cols, boolean[] sampled) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Mask dimensions must be positive, got " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.sampled = sampled;
        int count = 0;
        for (boolean s : sampled) {
            if (s) count++;
        }
        this.sampledCount = count;
    }

    /**
     * Creates a mask from a row-major grid. Any non-zero cell counts as sampled.
     *
     * @param grid rectangular grid, {@code grid[row][col]}
     * @return the mask
     * @throws IllegalArgumentException if the grid is empty or ragged
     */
    public static SpatialMask of(int[][] grid) {
        if (grid == null || grid.length == 0 || grid[0].length == 0) {
            throw new IllegalArgumentException("Mask grid must not be empty");
        }
        int rows = grid.length;
        int cols = grid[0].length;
        boolean[] sampled = new boolean[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (grid[r].length != cols) {
                throw new IllegalArgumentException("Mask grid is ragged at row " + r);
            }
            for (int c = 0; c < cols; c++) {
                sampled[r * cols + c] = grid[r][c] != 0;
            }
        }
        return new SpatialMask(rows, cols, sampled);
    }

    /**
     * Creates a mask where every pixel is sampled.
     */
    public static SpatialMask full(int rows, int cols) {
        boolean[] sampled = new boolean[rows * cols];
        Arrays.fill(sampled, true);
        return new SpatialMask(rows, cols, sampled);
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public int getPixelCount() {
        return rows * cols;
    }

    public int sampledPixelCount() {
        return sampledCount;
    }

    public boolean isSampled(int row, int col) {
        checkBounds(row, col);
        return sampled[row * cols + col];
    }

    /**
     * Row-major sampled flag by flat pixel index.
     */
    public boolean isSampled(int pixelIndex) {
        return sampled[pixelIndex];
    }

    /**
     * Whether a matrix of the given shape lives in this mask's coordinate space.
     */
    public boolean matchesShape(int otherRows, int otherCols) {
        return rows == otherRows && cols == otherCols;
    }

    private void checkBounds(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException(
                String.format("Pixel (%d, %d) outside mask of shape %dx%d", row, col, rows, cols));
        }
    }

    @Override
    public String toString() {
        return "SpatialMask[" + rows + "x" + cols + ", sampled=" + sampledCount + "]";
    }
}
