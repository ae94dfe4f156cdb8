package org.propensa.compiler.backend.matrix;

import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrays;

import java.util.Arrays;

/**
 * Immutable sparse integer matrix in compressed sparse column (CSC) form.
 * <p>
 * Built through a {@link Builder} that accumulates entries: adding to the same position twice
 * sums the values. Entries that sum to zero are not stored.
 */
public final class SparseIntMatrix {

    private final int rows;
    private final int columns;
    private final int[] jc;
    private final int[] ir;
    private final int[] pr;

    private SparseIntMatrix(int rows, int columns, int[] jc, int[] ir, int[] pr) {
        this.rows = rows;
        this.columns = columns;
        this.jc = jc;
        this.ir = ir;
        this.pr = pr;
    }

    /**
     * Creates a builder for a matrix of the given shape.
     * @param rows    Number of rows.
     * @param columns Number of columns.
     * @return A new builder with all entries zero.
     */
    public static Builder builder(int rows, int columns) {
        return new Builder(rows, columns);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    /**
     * @return The value at the given position, zero if not stored.
     */
    public int get(int row, int column) {
        checkBounds(row, column);
        int k = Arrays.binarySearch(ir, jc[column], jc[column + 1], row);
        return k >= 0 ? pr[k] : 0;
    }

    /**
     * @return A dense copy of one column.
     */
    public int[] column(int column) {
        if (column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("Column " + column + " outside " + rows + "x" + columns);
        }
        int[] dense = new int[rows];
        for (int k = jc[column]; k < jc[column + 1]; k++) {
            dense[ir[k]] = pr[k];
        }
        return dense;
    }

    /**
     * @return A dense row-major copy of the matrix.
     */
    public int[][] toDense() {
        int[][] dense = new int[rows][columns];
        for (int c = 0; c < columns; c++) {
            for (int k = jc[c]; k < jc[c + 1]; k++) {
                dense[ir[k]][c] = pr[k];
            }
        }
        return dense;
    }

    /**
     * @return The number of stored (nonzero) entries.
     */
    public int nonZeroCount() {
        return pr.length;
    }

    /** Column pointers: entries of column {@code c} are stored at {@code [jc[c], jc[c+1])}. */
    public int[] jc() {
        return jc.clone();
    }

    /** Row index of each stored entry. */
    public int[] ir() {
        return ir.clone();
    }

    /** Value of each stored entry. */
    public int[] pr() {
        return pr.clone();
    }

    private void checkBounds(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("(" + row + ", " + column + ") outside " + rows + "x" + columns);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SparseIntMatrix other)) return false;
        return rows == other.rows && columns == other.columns
                && Arrays.equals(jc, other.jc) && Arrays.equals(ir, other.ir) && Arrays.equals(pr, other.pr);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * rows + columns) + Arrays.hashCode(ir)) + Arrays.hashCode(pr);
    }

    @Override
    public String toString() {
        return "SparseIntMatrix[" + rows + "x" + columns + ", nnz=" + pr.length + "]";
    }

    /**
     * Accumulates entries of a {@link SparseIntMatrix}. Not thread-safe.
     */
    public static final class Builder {
        private final int rows;
        private final int columns;
        private final Long2IntOpenHashMap entries = new Long2IntOpenHashMap();

        private Builder(int rows, int columns) {
            if (rows < 0 || columns < 0) {
                throw new IllegalArgumentException("Negative matrix shape: " + rows + "x" + columns);
            }
            this.rows = rows;
            this.columns = columns;
        }

        /**
         * Adds {@code value} to the entry at ({@code row}, {@code column}).
         * @return This builder.
         */
        public Builder add(int row, int column, int value) {
            if (row < 0 || row >= rows || column < 0 || column >= columns) {
                throw new IndexOutOfBoundsException("(" + row + ", " + column + ") outside " + rows + "x" + columns);
            }
            entries.addTo(key(row, column), value);
            return this;
        }

        public SparseIntMatrix build() {
            long[] keys = entries.long2IntEntrySet().stream()
                    .filter(e -> e.getIntValue() != 0)
                    .mapToLong(Long2IntMap.Entry::getLongKey)
                    .toArray();
            LongArrays.quickSort(keys);

            int[] jc = new int[columns + 1];
            int[] ir = new int[keys.length];
            int[] pr = new int[keys.length];
            for (int k = 0; k < keys.length; k++) {
                int column = (int) (keys[k] >>> 32);
                ir[k] = (int) keys[k];
                pr[k] = entries.get(keys[k]);
                jc[column + 1]++;
            }
            for (int c = 0; c < columns; c++) {
                jc[c + 1] += jc[c];
            }
            return new SparseIntMatrix(rows, columns, jc, ir, pr);
        }
    }

    // column-major key so that sorting yields CSC order
    static long key(int row, int column) {
        return ((long) column << 32) | (row & 0xFFFFFFFFL);
    }
}
