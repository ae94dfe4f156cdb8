package org.propensa.compiler.backend.matrix;

import it.unimi.dsi.fastutil.longs.LongArrays;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

import java.util.Arrays;

/**
 * Immutable sparse boolean matrix in compressed sparse column (CSC) form. Only the positions of
 * {@code true} entries are stored.
 */
public final class BooleanMatrix {

    private final int rows;
    private final int columns;
    private final int[] jc;
    private final int[] ir;

    private BooleanMatrix(int rows, int columns, int[] jc, int[] ir) {
        this.rows = rows;
        this.columns = columns;
        this.jc = jc;
        this.ir = ir;
    }

    public static Builder builder(int rows, int columns) {
        return new Builder(rows, columns);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public boolean get(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("(" + row + ", " + column + ") outside " + rows + "x" + columns);
        }
        return Arrays.binarySearch(ir, jc[column], jc[column + 1], row) >= 0;
    }

    /**
     * @return A dense row-major copy of the matrix.
     */
    public boolean[][] toDense() {
        boolean[][] dense = new boolean[rows][columns];
        for (int c = 0; c < columns; c++) {
            for (int k = jc[c]; k < jc[c + 1]; k++) {
                dense[ir[k]][c] = true;
            }
        }
        return dense;
    }

    public int nonZeroCount() {
        return ir.length;
    }

    /** Column pointers: entries of column {@code c} are stored at {@code [jc[c], jc[c+1])}. */
    public int[] jc() {
        return jc.clone();
    }

    /** Row index of each {@code true} entry. */
    public int[] ir() {
        return ir.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BooleanMatrix other)) return false;
        return rows == other.rows && columns == other.columns
                && Arrays.equals(jc, other.jc) && Arrays.equals(ir, other.ir);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.hashCode(ir);
    }

    @Override
    public String toString() {
        return "BooleanMatrix[" + rows + "x" + columns + ", nnz=" + ir.length + "]";
    }

    /**
     * Collects the {@code true} entries of a {@link BooleanMatrix}. Setting an entry twice has no
     * further effect. Not thread-safe.
     */
    public static final class Builder {
        private final int rows;
        private final int columns;
        private final LongOpenHashSet entries = new LongOpenHashSet();

        private Builder(int rows, int columns) {
            if (rows < 0 || columns < 0) {
                throw new IllegalArgumentException("Negative matrix shape: " + rows + "x" + columns);
            }
            this.rows = rows;
            this.columns = columns;
        }

        public Builder set(int row, int column) {
            if (row < 0 || row >= rows || column < 0 || column >= columns) {
                throw new IndexOutOfBoundsException("(" + row + ", " + column + ") outside " + rows + "x" + columns);
            }
            entries.add(SparseIntMatrix.key(row, column));
            return this;
        }

        public BooleanMatrix build() {
            long[] keys = entries.toLongArray();
            LongArrays.quickSort(keys);

            int[] jc = new int[columns + 1];
            int[] ir = new int[keys.length];
            for (int k = 0; k < keys.length; k++) {
                ir[k] = (int) keys[k];
                jc[(int) (keys[k] >>> 32) + 1]++;
            }
            for (int c = 0; c < columns; c++) {
                jc[c + 1] += jc[c];
            }
            return new BooleanMatrix(rows, columns, jc, ir);
        }
    }
}
