package org.ionresults.datapipeline.api.model;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Coordinate-format intensity matrix of one isotope peak image.
 * <p>
 * Stores only the (row, col, value) triples produced by the search. Explicit zero entries
 * are retained as given; a matrix with no non-zero value is still a present image.
 * Duplicate coordinates are allowed and summed by {@link #toDense()}.
 * <p>
 * <strong>Thread Safety:</strong> Immutable after construction.
 */
public final class SparseIntensityMatrix {

    private final int rows;
    private final int cols;
    private final int[] rowIndices;
    private final int[] colIndices;
    private final double[] values;

    private SparseIntensityMatrix(int rows, int cols, int[] rowIndices, int[] colIndices, double[] values) {
        this.rows = rows;
        this.cols = cols;
        this.rowIndices = rowIndices;
        this.colIndices = colIndices;
        this.values = values;
    }

    public static Builder builder(int rows, int cols) {
        return new Builder(rows, cols);
    }

    /**
     * Collects the non-zero cells of a dense grid.
     *
     * @param grid rectangular grid, {@code grid[row][col]}
     * @return the sparse matrix with one entry per non-zero cell
     */
    public static SparseIntensityMatrix fromDense(double[][] grid) {
        if (grid.length == 0) {
            throw new IllegalArgumentException("Grid must have at least one row");
        }
        Builder builder = builder(grid.length, grid[0].length);
        for (int r = 0; r < grid.length; r++) {
            if (grid[r].length != grid[0].length) {
                throw new IllegalArgumentException("Grid is ragged at row " + r);
            }
            for (int c = 0; c < grid[r].length; c++) {
                if (grid[r][c] != 0.0) {
                    builder.add(r, c, grid[r][c]);
                }
            }
        }
        return builder.build();
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    /** Number of stored entries, explicit zeros included. */
    public int storedEntries() {
        return values.length;
    }

    public int rowAt(int entry) {
        return rowIndices[entry];
    }

    public int colAt(int entry) {
        return colIndices[entry];
    }

    public double valueAt(int entry) {
        return values[entry];
    }

    /**
     * Expands the matrix into a row-major raster of {@code rows * cols} cells.
     *
     * @return a freshly allocated raster
     */
    public double[] toDense() {
        double[] dense = new double[rows * cols];
        for (int i = 0; i < values.length; i++) {
            dense[rowIndices[i] * cols + colIndices[i]] += values[i];
        }
        return dense;
    }

    @Override
    public String toString() {
        return "SparseIntensityMatrix[" + rows + "x" + cols + ", entries=" + values.length + "]";
    }

    /**
     * Accumulates entries in primitive lists before freezing them into arrays.
     * Not thread-safe.
     */
    public static final class Builder {
        private final int rows;
        private final int cols;
        private final IntArrayList rowIndices = new IntArrayList();
        private final IntArrayList colIndices = new IntArrayList();
        private final DoubleArrayList values = new DoubleArrayList();

        private Builder(int rows, int cols) {
            if (rows <= 0 || cols <= 0) {
                throw new IllegalArgumentException("Matrix dimensions must be positive, got " + rows + "x" + cols);
            }
            this.rows = rows;
            this.cols = cols;
        }

        public Builder add(int row, int col, double value) {
            if (row < 0 || row >= rows || col < 0 || col >= cols) {
                throw new IndexOutOfBoundsException(
                    String.format("Entry (%d, %d) outside matrix of shape %dx%d", row, col, rows, cols));
            }
            rowIndices.add(row);
            colIndices.add(col);
            values.add(value);
            return this;
        }

        public SparseIntensityMatrix build() {
            return new SparseIntensityMatrix(rows, cols,
                rowIndices.toIntArray(), colIndices.toIntArray(), values.toDoubleArray());
        }
    }
}
