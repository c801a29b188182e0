package org.cranes.solver;

import lombok.extern.slf4j.Slf4j;
import org.cranes.core.CraneUnloadingException;
import org.cranes.grid.CellKind;
import org.cranes.grid.Grid;
import org.cranes.path.Path;
import org.cranes.path.StepDirection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Dynamic-programming crane unloading solver.
 *
 * <p>Table entry {@code A[r][c]} holds the best path ending exactly at {@code (r,c)},
 * or nothing when the cell is unreachable. Entries are filled in row-major order so
 * both predecessors {@code (r-1,c)} and {@code (r,c-1)} are final before {@code (r,c)}
 * is evaluated:</p>
 * <ul>
 * <li>{@code fromAbove}: copy of {@code A[r-1][c]} extended {@code SOUTH}.</li>
 * <li>{@code fromLeft}: copy of {@code A[r][c-1]} extended {@code EAST}.</li>
 * <li>When both exist, {@code fromLeft} wins only with strictly more cranes.</li>
 * </ul>
 * <p>Building cells never receive an entry. The final answer is the first entry in
 * row-major order with the strictly greatest crane count.</p>
 *
 * <p>Runs in {@code O(rows * columns * (rows + columns))} time and space because every
 * entry owns its own copy of the move sequence.</p>
 */
@Slf4j
public final class DynamicProgrammingSolver implements CraneUnloadingSolver {

    @Override
    public Path solve(Grid grid) {
        SolverContracts.requireSolvable(grid);
        int rows = grid.rows();
        int columns = grid.columns();

        // Row-major: entry (r,c) lives at r * columns + c.
        List<Optional<Path>> table = new ArrayList<>(Collections.nCopies(rows * columns, Optional.<Path>empty()));
        table.set(0, Optional.of(new Path(grid)));

        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                if ((r == 0 && c == 0) || grid.get(r, c) == CellKind.BUILDING) {
                    continue;
                }
                Optional<Path> fromAbove = r > 0
                        ? extend(table.get((r - 1) * columns + c), StepDirection.SOUTH)
                        : Optional.empty();
                Optional<Path> fromLeft = c > 0
                        ? extend(table.get(r * columns + c - 1), StepDirection.EAST)
                        : Optional.empty();
                table.set(r * columns + c, choose(fromAbove, fromLeft));
            }
        }

        Path best = table.get(0).orElseThrow(() -> new CraneUnloadingException(
                CraneUnloadingException.REASON_TABLE_INCONSISTENT,
                "start entry missing from table"
        ));
        for (Optional<Path> entry : table) {
            if (entry.isPresent() && entry.get().totalCranes() > best.totalCranes()) {
                best = entry.get();
            }
        }

        log.debug("dynamic programming solve {}x{}: bestCranes={}, end=({},{})",
                rows, columns, best.totalCranes(), best.row(), best.column());
        return best;
    }

    @Override
    public SolverAlgorithm algorithm() {
        return SolverAlgorithm.DYNAMIC_PROGRAMMING;
    }

    /**
     * Copies a predecessor entry and extends it by one move.
     *
     * @return the extended copy, or empty when the predecessor is absent or the move is invalid.
     */
    private static Optional<Path> extend(Optional<Path> predecessor, StepDirection direction) {
        if (predecessor.isEmpty() || !predecessor.get().isStepValid(direction)) {
            return Optional.empty();
        }
        Path extended = predecessor.get().copy();
        extended.addStep(direction);
        return Optional.of(extended);
    }

    /**
     * Picks the better of two candidate entries; ties go to {@code fromAbove}.
     */
    private static Optional<Path> choose(Optional<Path> fromAbove, Optional<Path> fromLeft) {
        if (fromAbove.isPresent() && fromLeft.isPresent()) {
            return fromLeft.get().totalCranes() > fromAbove.get().totalCranes() ? fromLeft : fromAbove;
        }
        return fromAbove.isPresent() ? fromAbove : fromLeft;
    }
}
