package org.cranes.path;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.cranes.core.CraneUnloadingException;
import org.cranes.grid.CellKind;
import org.cranes.grid.Grid;
import org.cranes.grid.GridCell;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Monotone East/South walk over one grid, starting at cell (0,0).
 *
 * <p>Position and crane count are maintained incrementally as steps are added,
 * so reading them is O(1). Moves are kept as direction ordinals in a primitive
 * byte list.</p>
 *
 * <p><strong>Invariants:</strong></p>
 * <ul>
 * <li>The current position always lies inside the grid and is never a {@code BUILDING}.</li>
 * <li>{@code length() <= rows + columns - 2}.</li>
 * <li>The crane count never decreases; each cell is counted once because moves never revisit a cell.</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> not thread-safe. Use {@link #copy()} to hand a
 * path to another owner.</p>
 */
@Getter
@Accessors(fluent = true)
public final class Path {
    private static final StepDirection[] DIRECTIONS = StepDirection.values();

    /** Grid this path walks on. */
    private final Grid grid;
    /** Current row. */
    private int row;
    /** Current column. */
    private int column;
    /** Cranes collected so far, start cell included. */
    private int totalCranes;

    @Getter(AccessLevel.NONE)
    private final ByteArrayList moves;

    /**
     * Creates the zero-length path at the start cell.
     *
     * @param grid grid to walk on.
     */
    public Path(Grid grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.moves = new ByteArrayList();
        this.row = 0;
        this.column = 0;
        this.totalCranes = grid.contains(0, 0) && grid.get(0, 0) == CellKind.CRANE ? 1 : 0;
    }

    private Path(Path source) {
        this.grid = source.grid;
        this.moves = source.moves.clone();
        this.row = source.row;
        this.column = source.column;
        this.totalCranes = source.totalCranes;
    }

    /**
     * Rebuilds a path by replaying a move sequence from the start cell.
     *
     * @param grid grid to walk on.
     * @param steps moves in order.
     * @return replayed path.
     * @throws CraneUnloadingException with {@link CraneUnloadingException#REASON_INVALID_STEP}
     *                                 at the first move that leaves the grid or enters a building.
     */
    public static Path replay(Grid grid, List<StepDirection> steps) {
        Path path = new Path(grid);
        for (StepDirection step : Objects.requireNonNull(steps, "steps")) {
            path.addStep(step);
        }
        return path;
    }

    /**
     * Returns whether one more move in {@code direction} stays inside the grid
     * and lands on a non-building cell.
     */
    public boolean isStepValid(StepDirection direction) {
        int nextRow = row + direction.rowDelta();
        int nextColumn = column + direction.columnDelta();
        return grid.contains(nextRow, nextColumn) && grid.get(nextRow, nextColumn) != CellKind.BUILDING;
    }

    /**
     * Appends one move.
     *
     * <p>Callers must check {@link #isStepValid(StepDirection)} first.</p>
     *
     * @param direction move to append.
     * @throws CraneUnloadingException when the move is invalid.
     */
    public void addStep(StepDirection direction) {
        Objects.requireNonNull(direction, "direction");
        if (!isStepValid(direction)) {
            throw new CraneUnloadingException(
                    CraneUnloadingException.REASON_INVALID_STEP,
                    "step " + direction + " from (" + row + "," + column + ") leaves the grid or enters a building"
            );
        }
        moves.add((byte) direction.ordinal());
        row += direction.rowDelta();
        column += direction.columnDelta();
        if (grid.get(row, column) == CellKind.CRANE) {
            totalCranes++;
        }
    }

    /**
     * Returns the number of moves.
     */
    public int length() {
        return moves.size();
    }

    /**
     * Returns the moves in order as an immutable list.
     */
    public List<StepDirection> steps() {
        List<StepDirection> steps = new ArrayList<>(moves.size());
        for (int i = 0; i < moves.size(); i++) {
            steps.add(DIRECTIONS[moves.getByte(i)]);
        }
        return List.copyOf(steps);
    }

    /**
     * Returns every visited cell, start cell first.
     */
    public List<GridCell> cells() {
        List<GridCell> cells = new ArrayList<>(moves.size() + 1);
        int r = 0;
        int c = 0;
        cells.add(new GridCell(r, c));
        for (int i = 0; i < moves.size(); i++) {
            StepDirection step = DIRECTIONS[moves.getByte(i)];
            r += step.rowDelta();
            c += step.columnDelta();
            cells.add(new GridCell(r, c));
        }
        return List.copyOf(cells);
    }

    /**
     * Returns an independent copy sharing only the immutable grid.
     */
    public Path copy() {
        return new Path(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Path other)) {
            return false;
        }
        return grid.equals(other.grid) && moves.equals(other.moves);
    }

    @Override
    public int hashCode() {
        return 31 * grid.hashCode() + moves.hashCode();
    }

    @Override
    public String toString() {
        return "Path{" +
                "end=(" + row + "," + column + ")" +
                ", cranes=" + totalCranes +
                ", steps=" + steps() +
                '}';
    }
}
