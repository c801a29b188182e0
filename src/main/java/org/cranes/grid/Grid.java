package org.cranes.grid;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable rectangular grid of {@link CellKind} classifications.
 *
 * <p>Cells are stored in one row-major array; {@code get(row, column)} reads
 * index {@code row * columns + column}. Instances are safe to share across
 * threads.</p>
 */
@Getter
@Accessors(fluent = true)
public final class Grid {
    /** Number of rows (south axis). */
    private final int rows;
    /** Number of columns (east axis). */
    private final int columns;

    @Getter(AccessLevel.NONE)
    private final CellKind[] cells;

    private Grid(int rows, int columns, CellKind[] cells) {
        this.rows = rows;
        this.columns = columns;
        this.cells = cells;
    }

    /**
     * Creates a grid from a rectangular array of rows.
     *
     * <p>The input is copied, so later changes to {@code layout} do not leak
     * into the grid.</p>
     *
     * @param layout cell classifications indexed as {@code layout[row][column]}.
     * @return immutable grid.
     * @throws IllegalArgumentException when the layout is null, ragged, holds null cells, or is too large.
     */
    public static Grid of(CellKind[][] layout) {
        if (layout == null) {
            throw new IllegalArgumentException("layout cannot be null");
        }
        int rows = layout.length;
        int columns = rows == 0 ? 0 : requireRow(layout, 0).length;
        CellKind[] cells = new CellKind[cellCount(rows, columns)];
        for (int r = 0; r < rows; r++) {
            CellKind[] row = requireRow(layout, r);
            if (row.length != columns) {
                throw new IllegalArgumentException(
                        "layout must be rectangular: row " + r + " has " + row.length + " columns, expected " + columns
                );
            }
            for (int c = 0; c < columns; c++) {
                if (row[c] == null) {
                    throw new IllegalArgumentException("layout cell (" + r + "," + c + ") cannot be null");
                }
                cells[r * columns + c] = row[c];
            }
        }
        return new Grid(rows, columns, cells);
    }

    /**
     * Starts a builder for a grid of the given size with every cell {@code EMPTY}.
     *
     * @param rows number of rows.
     * @param columns number of columns.
     * @return mutable builder.
     * @throws IllegalArgumentException when a dimension is negative or {@code rows * columns} overflows.
     */
    public static Builder builder(int rows, int columns) {
        return new Builder(rows, columns);
    }

    /**
     * Returns the classification of one cell.
     *
     * @param row zero-based row.
     * @param column zero-based column.
     * @return cell classification.
     * @throws IndexOutOfBoundsException when the coordinate lies outside the grid.
     */
    public CellKind get(int row, int column) {
        if (!contains(row, column)) {
            throw new IndexOutOfBoundsException(
                    "Cell (" + row + "," + column + ") out of bounds [0, " + rows + ") x [0, " + columns + ")"
            );
        }
        return cells[row * columns + column];
    }

    /**
     * Returns whether the coordinate lies inside the grid.
     */
    public boolean contains(int row, int column) {
        return row >= 0 && row < rows && column >= 0 && column < columns;
    }

    /**
     * Returns whether the grid has no cells at all.
     */
    public boolean isEmpty() {
        return rows == 0 || columns == 0;
    }

    /**
     * Counts every {@code CRANE} cell in the grid.
     *
     * <p>No path can collect more cranes than this.</p>
     */
    public int craneCount() {
        int count = 0;
        for (CellKind cell : cells) {
            if (cell == CellKind.CRANE) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Grid other)) {
            return false;
        }
        return rows == other.rows && columns == other.columns && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows, columns, Arrays.hashCode(cells));
    }

    @Override
    public String toString() {
        return "Grid{" + rows + "x" + columns + ", cranes=" + craneCount() + '}';
    }

    /**
     * Returns {@code rows * columns}, rejecting sizes that do not fit one array.
     */
    private static int cellCount(int rows, int columns) {
        try {
            return Math.multiplyExact(rows, columns);
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Grid too large: " + rows + "x" + columns + " cells overflow int", ex);
        }
    }

    private static CellKind[] requireRow(CellKind[][] layout, int r) {
        CellKind[] row = layout[r];
        if (row == null) {
            throw new IllegalArgumentException("layout row " + r + " cannot be null");
        }
        return row;
    }

    /**
     * Mutable builder; every cell starts as {@code EMPTY}.
     */
    public static final class Builder {
        private final int rows;
        private final int columns;
        private final CellKind[] cells;

        private Builder(int rows, int columns) {
            if (rows < 0 || columns < 0) {
                throw new IllegalArgumentException("Grid dimensions must be non-negative, got " + rows + "x" + columns);
            }
            this.rows = rows;
            this.columns = columns;
            this.cells = new CellKind[cellCount(rows, columns)];
            Arrays.fill(cells, CellKind.EMPTY);
        }

        /**
         * Sets one cell classification.
         *
         * @throws IndexOutOfBoundsException when the coordinate lies outside the grid.
         */
        public Builder cell(int row, int column, CellKind kind) {
            if (row < 0 || row >= rows || column < 0 || column >= columns) {
                throw new IndexOutOfBoundsException("Cell (" + row + "," + column + ") out of bounds");
            }
            cells[row * columns + column] = Objects.requireNonNull(kind, "kind");
            return this;
        }

        /**
         * Freezes the current cell contents into an immutable grid.
         */
        public Grid build() {
            return new Grid(rows, columns, cells.clone());
        }
    }
}
